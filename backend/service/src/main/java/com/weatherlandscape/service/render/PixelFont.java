package com.weatherlandscape.service.render;

import java.awt.Graphics2D;
import java.util.Map;

final class PixelFont {
    private static final int GLYPH_WIDTH = 3;
    private static final int GLYPH_HEIGHT = 5;
    private static final Map<Character, String[]> GLYPHS = Map.ofEntries(
            Map.entry('0', new String[]{"###", "#.#", "#.#", "#.#", "###"}),
            Map.entry('1', new String[]{".#.", "##.", ".#.", ".#.", "###"}),
            Map.entry('2', new String[]{"###", "..#", "###", "#..", "###"}),
            Map.entry('3', new String[]{"###", "..#", "###", "..#", "###"}),
            Map.entry('4', new String[]{"#.#", "#.#", "###", "..#", "..#"}),
            Map.entry('5', new String[]{"###", "#..", "###", "..#", "###"}),
            Map.entry('6', new String[]{"###", "#..", "###", "#.#", "###"}),
            Map.entry('7', new String[]{"###", "..#", "..#", "..#", "..#"}),
            Map.entry('8', new String[]{"###", "#.#", "###", "#.#", "###"}),
            Map.entry('9', new String[]{"###", "#.#", "###", "..#", "###"}),
            Map.entry('-', new String[]{"...", "...", "###", "...", "..."}),
            Map.entry('\'', new String[]{"##.", "##.", "...", "...", "..."}),
            Map.entry('F', new String[]{"###", "#..", "##.", "#..", "#.."}),
            Map.entry('C', new String[]{"###", "#..", "#..", "#..", "###"})
    );

    private PixelFont() {
    }

    static int width(String text, int scale) {
        if (text.isEmpty()) {
            return 0;
        }
        return text.length() * (GLYPH_WIDTH + 1) * scale - scale;
    }

    static void draw(Graphics2D g, String text, int x, int y, int scale) {
        int cursor = x;
        for (char c : text.toCharArray()) {
            String[] rows = GLYPHS.get(c);
            if (rows != null) {
                for (int row = 0; row < GLYPH_HEIGHT; row++) {
                    for (int col = 0; col < GLYPH_WIDTH; col++) {
                        if (rows[row].charAt(col) == '#') {
                            g.fillRect(cursor + col * scale, y + row * scale, scale, scale);
                        }
                    }
                }
            }
            cursor += (GLYPH_WIDTH + 1) * scale;
        }
    }
}

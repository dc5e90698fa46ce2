package com.weatherlandscape.service.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.weatherlandscape.core.format.ImageEncoding;
import com.weatherlandscape.core.format.RenderConfig;
import com.weatherlandscape.pipeline.api.Renderer;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Polygon;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

public class LandscapeRenderer implements Renderer {
    public static final int WIDTH = 296;
    public static final int HEIGHT = 128;

    private static final int FORECAST_SLOTS = 8;
    private static final int HORIZON_TOP = 70;
    private static final int HORIZON_BOTTOM = 110;
    private static final int FONT_SCALE = 3;

    @Override
    public byte[] render(RenderRequest request) {
        RenderConfig config = request.config();
        JsonNode current = request.weather().current();
        JsonNode forecast = request.weather().forecast();

        BufferedImage canvas = new BufferedImage(WIDTH, HEIGHT, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setColor(new Color(config.background()));
            g.fillRect(0, 0, WIDTH, HEIGHT);

            List<Slot> slots = forecastSlots(current, forecast);
            int[] horizon = drawHorizon(g, config, slots);
            drawHouse(g, config, horizon[0], current.path("wind").path("speed").asDouble(0));
            drawSky(g, config, condition(current));
            drawPrecipitation(g, config, slots, horizon);
            drawTemperature(g, config, current.path("main").path("temp"));
        } finally {
            g.dispose();
        }

        BufferedImage output = postProcess(canvas, config);
        return encode(output, config.encoding());
    }

    private static List<Slot> forecastSlots(JsonNode current, JsonNode forecast) {
        List<Slot> slots = new ArrayList<>();
        slots.add(new Slot(current.path("main").path("temp").asDouble(Double.NaN), condition(current)));
        JsonNode list = forecast.path("list");
        for (int i = 0; i < list.size() && slots.size() < FORECAST_SLOTS; i++) {
            JsonNode entry = list.get(i);
            slots.add(new Slot(entry.path("main").path("temp").asDouble(Double.NaN), condition(entry)));
        }
        return slots;
    }

    private static String condition(JsonNode node) {
        JsonNode weather = node.path("weather");
        if (!weather.isArray() || weather.isEmpty()) {
            return "";
        }
        return weather.get(0).path("main").asText("");
    }

    private static int[] drawHorizon(Graphics2D g, RenderConfig config, List<Slot> slots) {
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (Slot slot : slots) {
            if (!Double.isNaN(slot.kelvin())) {
                min = Math.min(min, slot.kelvin());
                max = Math.max(max, slot.kelvin());
            }
        }
        int[] ys = new int[slots.size()];
        for (int i = 0; i < slots.size(); i++) {
            double kelvin = slots.get(i).kelvin();
            if (Double.isNaN(kelvin) || max - min < 0.01) {
                ys[i] = (HORIZON_TOP + HORIZON_BOTTOM) / 2;
            } else {
                double ratio = (kelvin - min) / (max - min);
                ys[i] = (int) Math.round(HORIZON_BOTTOM - ratio * (HORIZON_BOTTOM - HORIZON_TOP));
            }
        }

        Polygon ground = new Polygon();
        ground.addPoint(0, HEIGHT);
        for (int i = 0; i < ys.length; i++) {
            ground.addPoint(columnX(i, ys.length), ys[i]);
        }
        ground.addPoint(WIDTH, ys[ys.length - 1]);
        ground.addPoint(WIDTH, HEIGHT);
        g.setColor(new Color(config.soil()));
        g.fillPolygon(ground);
        g.setColor(new Color(config.foreground()));
        for (int i = 1; i < ys.length; i++) {
            g.drawLine(columnX(i - 1, ys.length), ys[i - 1], columnX(i, ys.length), ys[i]);
        }
        return ys;
    }

    private static void drawHouse(Graphics2D g, RenderConfig config, int groundY, double windSpeed) {
        int x = 6;
        int base = Math.min(groundY, HEIGHT - 2);
        g.setColor(new Color(config.background()));
        g.fillRect(x, base - 14, 18, 14);
        g.setColor(new Color(config.foreground()));
        g.drawRect(x, base - 14, 18, 14);
        g.fillPolygon(new int[]{x - 2, x + 9, x + 20}, new int[]{base - 14, base - 24, base - 14}, 3);
        g.fillRect(x + 7, base - 7, 4, 7);
        g.fillRect(x + 13, base - 22, 3, 6);

        int lean = (int) Math.min(12, Math.round(windSpeed * 2));
        g.setColor(new Color(config.smoke()));
        for (int i = 1; i <= 4; i++) {
            g.fillOval(x + 13 + lean * i / 4, base - 24 - i * 5, 3 + i, 3 + i);
        }
    }

    private static void drawSky(Graphics2D g, RenderConfig config, String condition) {
        int cx = 60;
        int cy = 20;
        g.setColor(new Color(config.foreground()));
        switch (condition) {
            case "Clear" -> {
                g.drawOval(cx - 8, cy - 8, 16, 16);
                for (int i = 0; i < 8; i++) {
                    double angle = Math.PI * i / 4;
                    g.drawLine(cx + (int) (11 * Math.cos(angle)), cy + (int) (11 * Math.sin(angle)),
                            cx + (int) (15 * Math.cos(angle)), cy + (int) (15 * Math.sin(angle)));
                }
            }
            case "Clouds", "Mist", "Fog", "Haze", "Smoke" -> drawCloud(g, cx, cy);
            default -> {
                if (!condition.isEmpty()) {
                    drawCloud(g, cx, cy);
                    g.fillRect(cx - 10, cy + 8, 20, 2);
                }
            }
        }
    }

    private static void drawCloud(Graphics2D g, int cx, int cy) {
        g.drawOval(cx - 14, cy - 4, 14, 10);
        g.drawOval(cx - 6, cy - 9, 16, 14);
        g.drawOval(cx + 4, cy - 3, 12, 9);
    }

    private static void drawPrecipitation(Graphics2D g, RenderConfig config, List<Slot> slots, int[] horizon) {
        for (int i = 0; i < slots.size(); i++) {
            String condition = slots.get(i).condition();
            int x = columnX(i, slots.size());
            int top = 34;
            int bottom = horizon[i] - 4;
            if ("Rain".equals(condition) || "Drizzle".equals(condition) || "Thunderstorm".equals(condition)) {
                g.setColor(new Color(config.rain()));
                for (int y = top; y < bottom; y += 6) {
                    g.drawLine(x - 2, y, x - 4, y + 3);
                    g.drawLine(x + 3, y + 2, x + 1, y + 5);
                }
            } else if ("Snow".equals(condition)) {
                g.setColor(new Color(config.snow()));
                for (int y = top; y < bottom; y += 7) {
                    g.fillRect(x - 3, y, 2, 2);
                    g.fillRect(x + 2, y + 3, 2, 2);
                }
            }
        }
    }

    private static void drawTemperature(Graphics2D g, RenderConfig config, JsonNode kelvinNode) {
        String label;
        if (kelvinNode.isNumber()) {
            double kelvin = kelvinNode.asDouble();
            double value = config.temperatureUnit() == RenderConfig.TemperatureUnit.FAHRENHEIT
                    ? (kelvin - 273.15) * 9 / 5 + 32
                    : kelvin - 273.15;
            String unit = config.temperatureUnit() == RenderConfig.TemperatureUnit.FAHRENHEIT ? "F" : "C";
            label = Math.round(value) + "'" + unit;
        } else {
            label = "--";
        }
        int textWidth = PixelFont.width(label, FONT_SCALE);
        g.setColor(new Color(config.foreground()));
        PixelFont.draw(g, label, WIDTH - textWidth - 6, 6, FONT_SCALE);
    }

    private static int columnX(int index, int count) {
        if (count <= 1) {
            return WIDTH / 2;
        }
        int left = 40;
        int right = WIDTH - 8;
        return left + index * (right - left) / (count - 1);
    }

    static BufferedImage postProcess(BufferedImage canvas, RenderConfig config) {
        BufferedImage image = canvas;
        if (config.invert()) {
            for (int y = 0; y < image.getHeight(); y++) {
                for (int x = 0; x < image.getWidth(); x++) {
                    image.setRGB(x, y, ~image.getRGB(x, y) & 0xFFFFFF);
                }
            }
        }
        if (config.einkFlip()) {
            BufferedImage rotated = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
            for (int y = 0; y < image.getHeight(); y++) {
                for (int x = 0; x < image.getWidth(); x++) {
                    rotated.setRGB(image.getWidth() - 1 - x, image.getHeight() - 1 - y, image.getRGB(x, y));
                }
            }
            image = rotated;
        }
        if (config.spriteMode() == RenderConfig.SpriteMode.MONOCHROME) {
            BufferedImage binary = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_BYTE_BINARY);
            Graphics2D g = binary.createGraphics();
            try {
                g.drawImage(image, 0, 0, null);
            } finally {
                g.dispose();
            }
            image = binary;
        }
        return image;
    }

    private static byte[] encode(BufferedImage image, ImageEncoding encoding) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (!ImageIO.write(image, encoding.imageIoName(), out)) {
                throw new IllegalStateException("No ImageIO writer for " + encoding.imageIoName());
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed encoding " + encoding.imageIoName() + " image", e);
        }
        return out.toByteArray();
    }

    private record Slot(double kelvin, String condition) {
    }
}

package com.weatherlandscape.service.render;

import com.weatherlandscape.core.format.FormatId;
import com.weatherlandscape.core.model.WeatherPayload;
import com.weatherlandscape.core.util.JsonUtils;
import com.weatherlandscape.pipeline.api.Renderer.RenderRequest;
import com.weatherlandscape.service.support.Fixtures;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LandscapeRendererTest {
    private final LandscapeRenderer renderer = new LandscapeRenderer();

    @Test
    void everyFormatDecodesAtCardSize() throws IOException {
        for (FormatId format : FormatId.values()) {
            byte[] bytes = renderer.render(request(format));

            BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(bytes));
            assertEquals(LandscapeRenderer.WIDTH, decoded.getWidth(), format.id());
            assertEquals(LandscapeRenderer.HEIGHT, decoded.getHeight(), format.id());
        }
    }

    @Test
    void encodingMatchesFormatExtension() {
        byte[] png = renderer.render(request(FormatId.RGB_LIGHT));
        byte[] bmp = renderer.render(request(FormatId.BW));

        assertEquals((byte) 0x89, png[0]);
        assertEquals('P', png[1]);
        assertEquals('N', png[2]);
        assertEquals('G', png[3]);
        assertEquals('B', bmp[0]);
        assertEquals('M', bmp[1]);
    }

    @Test
    void monochromeFormatsContainOnlyBlackAndWhite() throws IOException {
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(renderer.render(request(FormatId.EINK))));

        for (int y = 0; y < decoded.getHeight(); y++) {
            for (int x = 0; x < decoded.getWidth(); x++) {
                int rgb = decoded.getRGB(x, y) & 0xFFFFFF;
                assertTrue(rgb == 0 || rgb == 0xFFFFFF, "pixel " + x + "," + y);
            }
        }
    }

    @Test
    void sameRequestSameBytes() {
        assertArrayEquals(renderer.render(request(FormatId.RGB_DARK)), renderer.render(request(FormatId.RGB_DARK)));
    }

    @Test
    void missingWeatherFieldsStillRender() {
        WeatherPayload sparse = new WeatherPayload(
                JsonUtils.objectMapper().createObjectNode(),
                JsonUtils.objectMapper().createObjectNode()
        );

        byte[] bytes = renderer.render(new RenderRequest(sparse, 0, 0, FormatId.BWI));

        assertTrue(bytes.length > 0);
    }

    @Test
    void invertFlipsEveryPixel() {
        BufferedImage canvas = new BufferedImage(4, 2, BufferedImage.TYPE_INT_RGB);
        canvas.setRGB(0, 0, 0xFFFFFF);

        BufferedImage out = LandscapeRenderer.postProcess(canvas, FormatId.BWI.renderConfig());

        assertEquals(0x000000, out.getRGB(0, 0) & 0xFFFFFF);
        assertEquals(0xFFFFFF, out.getRGB(1, 1) & 0xFFFFFF);
    }

    @Test
    void einkRotatesHalfATurn() {
        BufferedImage canvas = new BufferedImage(4, 2, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 2; y++) {
            for (int x = 0; x < 4; x++) {
                canvas.setRGB(x, y, 0xFFFFFF);
            }
        }
        canvas.setRGB(0, 0, 0x000000);

        BufferedImage out = LandscapeRenderer.postProcess(canvas, FormatId.EINK.renderConfig());

        assertEquals(0x000000, out.getRGB(3, 1) & 0xFFFFFF);
        assertEquals(0xFFFFFF, out.getRGB(0, 0) & 0xFFFFFF);
    }

    private static RenderRequest request(FormatId format) {
        return new RenderRequest(Fixtures.austinWeather(), 30.4521, -97.7688, format);
    }
}

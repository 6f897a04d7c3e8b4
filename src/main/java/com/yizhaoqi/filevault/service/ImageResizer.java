package com.yizhaoqi.filevault.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;

/**
 * Scales images to a target width with ImageIO and Java2D. The output keeps
 * the source format when a writer for it exists and falls back to PNG.
 */
@Component
public class ImageResizer {

    private static final Logger logger = LoggerFactory.getLogger(ImageResizer.class);

    private static final String FALLBACK_FORMAT = "png";

    /**
     * @return the scaled image bytes, or empty when the input is not an image ImageIO can decode,
     *         including truncated or corrupt data in a recognized format
     * @throws IOException when the scaled image cannot be encoded
     */
    public Optional<byte[]> resizeToWidth(byte[] imageBlob, int targetWidth) throws IOException {
        String format;
        BufferedImage image;
        try {
            format = detectFormat(imageBlob);
            image = ImageIO.read(new ByteArrayInputStream(imageBlob));
        } catch (IOException | RuntimeException e) {
            logger.warn("Failed to decode image of {} bytes: {}", imageBlob.length, e.getMessage());
            return Optional.empty();
        }
        if (image == null || image.getWidth() <= 0) {
            return Optional.empty();
        }

        int width = image.getWidth();
        int height = image.getHeight();
        int scaledHeight = Math.max(1, (int) Math.round((double) height * targetWidth / width));

        boolean opaqueFormat = "jpeg".equals(format) || "bmp".equals(format);
        int imageType = opaqueFormat ? BufferedImage.TYPE_INT_RGB : BufferedImage.TYPE_INT_ARGB;
        BufferedImage scaled = new BufferedImage(targetWidth, scaledHeight, imageType);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g.drawImage(image, 0, 0, targetWidth, scaledHeight, null);
        } finally {
            g.dispose();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        String outputFormat = format != null && ImageIO.getImageWritersByFormatName(format).hasNext()
                ? format
                : FALLBACK_FORMAT;
        if (!ImageIO.write(scaled, outputFormat, out)) {
            out.reset();
            ImageIO.write(scaled, FALLBACK_FORMAT, out);
        }
        return Optional.of(out.toByteArray());
    }


    private String detectFormat(byte[] imageBlob) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(imageBlob))) {
            if (input == null) {
                return null;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return null;
            }
            ImageReader reader = readers.next();
            try {
                String name = reader.getFormatName().toLowerCase(Locale.ROOT);
                return "jpg".equals(name) ? "jpeg" : name;
            } finally {
                reader.dispose();
            }
        }
    }
}

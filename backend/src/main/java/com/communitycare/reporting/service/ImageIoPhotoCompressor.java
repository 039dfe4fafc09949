package com.communitycare.reporting.service;

import com.communitycare.reporting.config.ReportingSettings;
import com.communitycare.reporting.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.Iterator;

/**
 * Downscales a base64 photo to fit the configured bounds and re-encodes it as a base64 JPEG.
 * Transparent areas are flattened onto white.
 */
@Service
public class ImageIoPhotoCompressor implements PhotoCompressor {
    private static final Logger log = LoggerFactory.getLogger(ImageIoPhotoCompressor.class);

    private final ReportingSettings settings;

    public ImageIoPhotoCompressor(ReportingSettings settings) {
        this.settings = settings;
    }

    @Override
    public String compress(String photo) {
        byte[] raw = decode(photo);
        if (raw.length > settings.getPhotoMaxBytes()) {
            throw new ValidationException("photo", "Photo exceeds " + settings.getPhotoMaxBytes() + " bytes");
        }
        BufferedImage source = read(raw);

        BufferedImage scaled = fitWithin(source, settings.getPhotoMaxWidth(), settings.getPhotoMaxHeight());
        byte[] jpeg = writeJpeg(scaled, settings.getPhotoQuality());
        log.debug("[PHOTO] {}x{} ({} bytes) -> {}x{} ({} bytes)", source.getWidth(), source.getHeight(), raw.length,
                scaled.getWidth(), scaled.getHeight(), jpeg.length);
        return Base64.getEncoder().encodeToString(jpeg);
    }

    private BufferedImage read(byte[] raw) {
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(raw))) {
            Iterator<ImageReader> readers = in == null ? null : ImageIO.getImageReaders(in);
            if (readers == null || !readers.hasNext()) {
                throw new ValidationException("photo", "Photo is not in a supported image format");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                long pixels = (long) reader.getWidth(0) * reader.getHeight(0);
                if (pixels > settings.getPhotoMaxPixels()) {
                    log.warn("[PHOTO] Rejected upload declaring {}x{}", reader.getWidth(0), reader.getHeight(0));
                    throw new ValidationException("photo", "Photo exceeds " + settings.getPhotoMaxPixels() + " pixels");
                }
                return reader.read(0);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            log.warn("[PHOTO] Unreadable upload ({} bytes): {}", raw.length, e.getMessage());
            throw new ValidationException("photo", "Photo could not be read as an image");
        }
    }

    private static byte[] decode(String photo) {
        String data = photo.trim();
        int comma = data.indexOf(',');
        if (data.startsWith("data:") && comma > 0) {
            data = data.substring(comma + 1);
        }
        try {
            return Base64.getMimeDecoder().decode(data);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("photo", "Photo must be base64 encoded");
        }
    }

    static BufferedImage fitWithin(BufferedImage source, int maxWidth, int maxHeight) {
        double scale = Math.min(1.0, Math.min((double) maxWidth / source.getWidth(), (double) maxHeight / source.getHeight()));
        int width = Math.max(1, (int) Math.round(source.getWidth() * scale));
        int height = Math.max(1, (int) Math.round(source.getHeight() * scale));

        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private static byte[] writeJpeg(BufferedImage image, float quality) {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IllegalStateException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ImageOutputStream out = ImageIO.createImageOutputStream(buffer)) {
            writer.setOutput(out);
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            writer.write(null, new IIOImage(image, null, null), param);
        } catch (IOException e) {
            throw new IllegalStateException("JPEG encoding failed", e);
        } finally {
            writer.dispose();
        }
        return buffer.toByteArray();
    }
}

package com.project.graph.digitizer.service;

import com.project.graph.digitizer.exceptions.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;

/** Decodes images with ImageIO; anything unreadable becomes an {@link InvalidInputException}. */
public class ImageLoader {
    private static final Logger log = LoggerFactory.getLogger(ImageLoader.class);

    public BufferedImage load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new InvalidInputException("Image not found or cannot be opened at path: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return decode(in, path.toString());
        } catch (IOException e) {
            throw new InvalidInputException("Cannot read image " + path + ": " + e.getMessage(), e);
        }
    }

    public BufferedImage load(InputStream in, String name) {
        try {
            return decode(in, name);
        } catch (IOException e) {
            throw new InvalidInputException("Cannot read image " + name + ": " + e.getMessage(), e);
        }
    }

    private BufferedImage decode(InputStream in, String name) throws IOException {
        BufferedImage image = ImageIO.read(in);
        if (image == null) {
            throw new InvalidInputException("Not a decodable image: " + name);
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new InvalidInputException("Image has no pixels: " + name);
        }
        log.debug("Image {} loaded: {}x{}", name, image.getWidth(), image.getHeight());
        return image;
    }
}

package com.project.graph.digitizer.service;

import com.project.graph.digitizer.DTOs.ColorRange;
import com.project.graph.digitizer.DTOs.HsvColor;
import com.project.graph.digitizer.DTOs.Mask;
import com.project.graph.digitizer.exceptions.InvalidInputException;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Marks the pixels whose HSV color lies inside a {@link ColorRange}.
 * <p>
 * Comparison happens in HSV rather than RGB so that anti-aliased edges and
 * background gradients of a rendered plot still fall inside a hue band.
 * Bounds are inclusive on all three channels.
 */
public class ColorSegmenter {

    public ColorSegmenter() {
        OpenCvLoader.ensureLoaded();
    }

    public Mask segment(BufferedImage image, ColorRange colorRange) {
        if (image == null) {
            throw new InvalidInputException("No image supplied");
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new InvalidInputException("Image has no pixels: " + image.getWidth() + "x" + image.getHeight());
        }
        if (colorRange == null) {
            throw new IllegalArgumentException("colorRange is required");
        }

        Mat bgr = bufferedImageToMat(image);
        Mat hsv = new Mat();
        Mat inRange = new Mat();
        try {
            Imgproc.cvtColor(bgr, hsv, Imgproc.COLOR_BGR2HSV);
            Core.inRange(hsv, toScalar(colorRange.lower()), toScalar(colorRange.upper()), inRange);
            return new Mask(image.getWidth(), image.getHeight(), matToBooleanArray(inRange));
        } finally {
            bgr.release();
            hsv.release();
            inRange.release();
        }
    }

    private static Scalar toScalar(HsvColor c) {
        return new Scalar(c.hue(), c.saturation(), c.value());
    }

    // always redraw: the source may be any type, or a subimage sharing a larger raster
    private static Mat bufferedImageToMat(BufferedImage image) {
        BufferedImage bgrImage = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = bgrImage.createGraphics();
        graphics.drawImage(image, 0, 0, null);
        graphics.dispose();
        byte[] pixels = ((DataBufferByte) bgrImage.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, pixels);
        return mat;
    }

    // inRange writes 255 for a match, 0 otherwise
    private static boolean[] matToBooleanArray(Mat mask) {
        int n = mask.rows() * mask.cols();
        byte[] data = new byte[n];
        mask.get(0, 0, data);

        boolean[] result = new boolean[n];
        for (int i = 0; i < n; i++) {
            result[i] = (data[i] & 0xFF) > 127;
        }
        return result;
    }
}

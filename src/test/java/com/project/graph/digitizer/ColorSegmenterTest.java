package com.project.graph.digitizer;

import com.project.graph.digitizer.DTOs.ColorRange;
import com.project.graph.digitizer.DTOs.Mask;
import com.project.graph.digitizer.config.DigitizerSettings;
import com.project.graph.digitizer.exceptions.InvalidInputException;
import com.project.graph.digitizer.service.ColorSegmenter;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColorSegmenterTest {
    private final ColorSegmenter segmenter = new ColorSegmenter();
    private final ColorRange blueRange = DigitizerSettings.defaults().colorRange();

    @Test
    void segment_marksOnlyBluePixels() {
        BufferedImage img = TestImages.withBluePixels(10, 10, new int[]{3, 2}, new int[]{7, 7});
        img.setRGB(5, 5, TestImages.RED);

        Mask mask = segmenter.segment(img, blueRange);

        assertThat(mask.width()).isEqualTo(10);
        assertThat(mask.height()).isEqualTo(10);
        assertThat(mask.count()).isEqualTo(2);
        assertThat(mask.isSet(3, 2)).isTrue();
        assertThat(mask.isSet(7, 7)).isTrue();
        assertThat(mask.isSet(5, 5)).isFalse();
        assertThat(mask.isSet(0, 0)).isFalse();
    }

    @Test
    void segment_boundsAreInclusiveOnHue() {
        BufferedImage img = TestImages.withBluePixels(3, 3, new int[]{1, 1});

        assertThat(segmenter.segment(img, ColorRange.parse("120,255,255", "120,255,255")).isSet(1, 1)).isTrue();
        assertThat(segmenter.segment(img, ColorRange.parse("121,0,0", "179,255,255")).isSet(1, 1)).isFalse();
        assertThat(segmenter.segment(img, ColorRange.parse("0,0,0", "119,255,255")).isSet(1, 1)).isFalse();
    }

    @Test
    void segment_boundsAreInclusiveOnSaturation() {
        BufferedImage img = TestImages.blank(3, 3);
        img.setRGB(1, 1, TestImages.PALE_BLUE);

        assertThat(segmenter.segment(img, ColorRange.parse("100,127,0", "140,255,255")).isSet(1, 1)).isTrue();
        assertThat(segmenter.segment(img, ColorRange.parse("100,0,0", "140,127,255")).isSet(1, 1)).isTrue();
        assertThat(segmenter.segment(img, ColorRange.parse("100,128,0", "140,255,255")).isSet(1, 1)).isFalse();
        assertThat(segmenter.segment(img, ColorRange.parse("100,0,0", "140,126,255")).isSet(1, 1)).isFalse();
    }

    @Test
    void segment_boundsAreInclusiveOnValue() {
        BufferedImage img = TestImages.blank(3, 3);
        img.setRGB(1, 1, TestImages.DARK_BLUE);

        assertThat(segmenter.segment(img, ColorRange.parse("100,150,200", "140,255,200")).isSet(1, 1)).isTrue();
        assertThat(segmenter.segment(img, ColorRange.parse("100,150,201", "140,255,255")).isSet(1, 1)).isFalse();
        assertThat(segmenter.segment(img, ColorRange.parse("100,150,0", "140,255,199")).isSet(1, 1)).isFalse();
    }

    @Test
    void segment_rejectsMissingImage() {
        assertThatThrownBy(() -> segmenter.segment(null, blueRange))
                .isInstanceOf(InvalidInputException.class);
    }
}

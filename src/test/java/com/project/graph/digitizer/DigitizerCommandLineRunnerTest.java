package com.project.graph.digitizer;

import com.project.graph.digitizer.DTOs.Sample;
import com.project.graph.digitizer.cli.DigitizerCommandLineRunner;
import com.project.graph.digitizer.config.DigitizerSettings;
import com.project.graph.digitizer.service.ColorSegmenter;
import com.project.graph.digitizer.service.ColumnAggregator;
import com.project.graph.digitizer.service.CoordinateExtractor;
import com.project.graph.digitizer.service.DigitizationService;
import com.project.graph.digitizer.service.Digitizer;
import com.project.graph.digitizer.service.ImageLoader;
import com.project.graph.digitizer.service.RangeNormalizer;
import com.project.graph.digitizer.service.SampleCsvWriter;
import com.project.graph.digitizer.service.TracePlotRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.awt.AWTError;
import java.awt.HeadlessException;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DigitizerCommandLineRunnerTest {

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream console = new ByteArrayOutputStream();
    private DigitizerCommandLineRunner runner;

    @BeforeEach
    void setup() {
        runner = runnerWith(new TracePlotRenderer());
    }

    private DigitizerCommandLineRunner runnerWith(TracePlotRenderer renderer) {
        DigitizerSettings settings = DigitizerSettings.defaults();
        Digitizer digitizer = new Digitizer(new ColorSegmenter(), new CoordinateExtractor(),
                new ColumnAggregator(), new RangeNormalizer());
        return new DigitizerCommandLineRunner(new DigitizationService(digitizer, new ImageLoader(), settings),
                new SampleCsvWriter(), renderer, new PrintStream(console, true, StandardCharsets.UTF_8));
    }

    private Path twoColumnPng() throws Exception {
        return TestImages.writePng(
                TestImages.withBluePixels(4, 10, new int[]{0, 2}, new int[]{0, 4}, new int[]{1, 9}),
                tmp.resolve("graph.png"));
    }

    private String console() {
        return console.toString(StandardCharsets.UTF_8);
    }

    @Test
    void execute_writesCsvAndReturnsZero() throws Exception {
        Path png = TestImages.writePng(
                TestImages.withBluePixels(4, 10, new int[]{0, 2}, new int[]{0, 4}, new int[]{1, 9}),
                tmp.resolve("graph.png"));
        Path csv = tmp.resolve("out.csv");

        int code = runner.execute(new String[]{png.toString(), "--output", csv.toString()});

        assertThat(code).isZero();
        assertThat(Files.readAllLines(csv)).containsExactly("X,Normalized Amplitude", "0,1.0", "1,0.0");
        assertThat(console()).contains("Normalized data saved to '" + csv + "'");
    }

    @Test
    void execute_reportsEmptyExtraction() throws Exception {
        Path png = TestImages.writePng(TestImages.blank(20, 20), tmp.resolve("blank.png"));

        int code = runner.execute(new String[]{png.toString(), "--output=" + tmp.resolve("x.csv")});

        assertThat(code).isEqualTo(1);
        assertThat(console()).startsWith("Error: ");
        assertThat(tmp.resolve("x.csv")).doesNotExist();
    }

    @Test
    void execute_reportsMissingImage() {
        assertThat(runner.execute(new String[]{tmp.resolve("missing.png").toString()})).isEqualTo(1);
        assertThat(console()).contains("Error: ").contains("missing.png");
    }

    @Test
    void execute_reportsFlatTrace() throws Exception {
        Path png = TestImages.writePng(TestImages.withBluePixels(10, 10, new int[]{3, 2}), tmp.resolve("dot.png"));

        assertThat(runner.execute(new String[]{png.toString(), "--output", tmp.resolve("d.csv").toString()}))
                .isEqualTo(1);
        assertThat(console()).contains("flat");
    }

    @Test
    void execute_showPlotWithoutDisplayReportsError() throws Exception {
        Path csv = tmp.resolve("plot.csv");

        int code = runner.execute(new String[]{twoColumnPng().toString(), "--output", csv.toString(), "--show-plot"});

        assertThat(code).isEqualTo(1);
        assertThat(csv).exists();
        assertThat(console()).contains("Error: ").contains("headless");
    }

    @Test
    void execute_headlessFailureOfPlotWindowIsReported() throws Exception {
        DigitizerCommandLineRunner failing = runnerWith(new TracePlotRenderer() {
            @Override
            public void show(List<Sample> samples) {
                throw new HeadlessException();
            }
        });

        int code = failing.execute(new String[]{twoColumnPng().toString(), "--output",
                tmp.resolve("h.csv").toString(), "--show-plot"});

        assertThat(code).isEqualTo(1);
        assertThat(console()).contains("Error: cannot show the plot");
    }

    @Test
    void execute_awtErrorOfPlotWindowIsReported() throws Exception {
        DigitizerCommandLineRunner failing = runnerWith(new TracePlotRenderer() {
            @Override
            public void show(List<Sample> samples) {
                throw new AWTError("Can't connect to X11 window server");
            }
        });

        int code = failing.execute(new String[]{twoColumnPng().toString(), "--output",
                tmp.resolve("a.csv").toString(), "--show-plot"});

        assertThat(code).isEqualTo(1);
        assertThat(console()).contains("Error: cannot show the plot").contains("X11");
    }

    @Test
    void execute_withoutShowPlotNeverOpensWindow() throws Exception {
        DigitizerCommandLineRunner failing = runnerWith(new TracePlotRenderer() {
            @Override
            public void show(List<Sample> samples) {
                throw new AssertionError("no window expected");
            }
        });

        assertThat(failing.execute(new String[]{twoColumnPng().toString(), "--output",
                tmp.resolve("n.csv").toString()})).isZero();
    }

    @Test
    void run_withoutPositionalArgumentDoesNothing() {
        runner.run(new DefaultApplicationArguments("--server.port=0"));

        assertThat(runner.getExitCode()).isZero();
        assertThat(console()).isEmpty();
    }
}

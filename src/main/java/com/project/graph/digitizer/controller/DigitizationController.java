package com.project.graph.digitizer.controller;

import com.project.graph.digitizer.DTOs.ColorRange;
import com.project.graph.digitizer.DTOs.DigitizationResult;
import com.project.graph.digitizer.DTOs.Sample;
import com.project.graph.digitizer.exceptions.DegenerateRangeException;
import com.project.graph.digitizer.exceptions.DigitizationException;
import com.project.graph.digitizer.exceptions.EmptyExtractionException;
import com.project.graph.digitizer.exceptions.InvalidInputException;
import com.project.graph.digitizer.service.DigitizationService;
import com.project.graph.digitizer.service.ImageLoader;
import com.project.graph.digitizer.service.SampleCsvWriter;
import com.project.graph.digitizer.service.StorageService;
import com.project.graph.digitizer.service.TracePlotRenderer;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;

@Controller
@ConditionalOnWebApplication
@Validated
public class DigitizationController {
    private static final Logger log = LoggerFactory.getLogger(DigitizationController.class);

    static final List<String> SUPPORTED_FORMATS = List.of(
            "image/png", "image/jpeg", "image/jpg", "image/gif", "image/bmp"
    );
    private static final long MAX_UPLOAD_BYTES = 10L * 1024 * 1024;
    private static final int MAX_DIMENSION = 4000;
    private static final int PREVIEW_ROWS = 20;
    private static final String HSV_TRIPLE = "^$|^\\s*\\d{1,3}\\s*,\\s*\\d{1,3}\\s*,\\s*\\d{1,3}\\s*$";

    private final DigitizationService digitizationService;
    private final StorageService storageService;
    private final ImageLoader imageLoader;
    private final SampleCsvWriter csvWriter;
    private final TracePlotRenderer plotRenderer;

    public DigitizationController(DigitizationService digitizationService, StorageService storageService,
                                  ImageLoader imageLoader, SampleCsvWriter csvWriter,
                                  TracePlotRenderer plotRenderer) {
        this.digitizationService = digitizationService;
        this.storageService = storageService;
        this.imageLoader = imageLoader;
        this.csvWriter = csvWriter;
        this.plotRenderer = plotRenderer;
    }

    @GetMapping("/digitize")
    public String showForm(Model model) {
        addFormDefaults(model);
        return "digitize";
    }

    @PostMapping(value = "/digitize", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String handleUpload(
            @RequestParam("file") @NotNull MultipartFile file,
            @RequestParam(name = "lower", defaultValue = "")
            @Pattern(regexp = HSV_TRIPLE, message = "Lower bound must look like h,s,v") String lower,
            @RequestParam(name = "upper", defaultValue = "")
            @Pattern(regexp = HSV_TRIPLE, message = "Upper bound must look like h,s,v") String upper,
            Model model
    ) throws IOException {

        validateUploadedFile(file);
        ColorRange range = resolveRange(lower, upper);

        log.info("Processing file: {} ({}KB), range [{}]..[{}]",
                file.getOriginalFilename(), file.getSize() / 1024, range.lower(), range.upper());

        try {
            // an undecodable upload is never stored
            BufferedImage input = loadAndValidateImage(file);
            var storedOriginal = storageService.store(file);
            DigitizationResult result = digitizationService.digitize(input, range);

            var csvStored = storageService.storeResult(csvWriter.toBytes(result.samples()), "_trace.csv");
            var plotStored = storageService.storeResult(plotRenderer.toPng(result.samples(), 900, 450), "_plot.png");

            populateResultModel(model, storedOriginal, csvStored, plotStored, result);
            log.info("Digitization completed for {}", file.getOriginalFilename());
            return "result";

        } catch (DigitizationException e) {
            log.warn("Digitization failed for {}: {}", file.getOriginalFilename(), e.getMessage());
            addFormDefaults(model);
            model.addAttribute("lower", range.lower().toString());
            model.addAttribute("upper", range.upper().toString());
            model.addAttribute("error", e.getMessage());
            model.addAttribute("suggestion", suggestionFor(e));
            return "digitize";
        }
    }

    private void addFormDefaults(Model model) {
        ColorRange defaults = digitizationService.getSettings().colorRange();
        model.addAttribute("lower", defaults.lower().toString());
        model.addAttribute("upper", defaults.upper().toString());
        model.addAttribute("supportedFormats", String.join(", ", SUPPORTED_FORMATS));
    }

    private ColorRange resolveRange(String lower, String upper) {
        ColorRange defaults = digitizationService.getSettings().colorRange();
        String lo = lower.isBlank() ? defaults.lower().toString() : lower;
        String hi = upper.isBlank() ? defaults.upper().toString() : upper;
        return ColorRange.parse(lo, hi);
    }

    private void validateUploadedFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Please choose an image to upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !SUPPORTED_FORMATS.contains(contentType.toLowerCase())) {
            throw new IllegalArgumentException("Unsupported file type: " + contentType
                    + ". Supported: " + String.join(", ", SUPPORTED_FORMATS));
        }
        if (file.getSize() > MAX_UPLOAD_BYTES) {
            throw new IllegalArgumentException("File too large. Maximum size: 10MB");
        }
    }

    private BufferedImage loadAndValidateImage(MultipartFile file) throws IOException {
        BufferedImage input;
        try (var inputStream = file.getInputStream()) {
            input = imageLoader.load(inputStream, file.getOriginalFilename());
        }
        if (input.getWidth() > MAX_DIMENSION || input.getHeight() > MAX_DIMENSION) {
            throw new InvalidInputException("Image too large. Maximum size: "
                    + MAX_DIMENSION + "x" + MAX_DIMENSION + " pixels");
        }
        return input;
    }

    private void populateResultModel(Model model, StorageService.StoredFile original,
                                     StorageService.StoredFile csv, StorageService.StoredFile plot,
                                     DigitizationResult result) {
        model.addAttribute("originalPath", "/" + original.relativeWebPath());
        model.addAttribute("csvPath", "/" + csv.relativeWebPath());
        model.addAttribute("plotPath", "/" + plot.relativeWebPath());

        model.addAttribute("width", result.width());
        model.addAttribute("height", result.height());
        model.addAttribute("lower", result.colorRange().lower().toString());
        model.addAttribute("upper", result.colorRange().upper().toString());
        model.addAttribute("sampleCount", result.sampleCount());
        model.addAttribute("degenerate", result.degenerate());

        List<Sample> samples = result.samples();
        model.addAttribute("preview", samples.subList(0, Math.min(PREVIEW_ROWS, samples.size())));
    }

    static String suggestionFor(DigitizationException e) {
        if (e instanceof EmptyExtractionException) {
            return "Widen the HSV range or check that the trace color matches it.";
        } else if (e instanceof DegenerateRangeException) {
            return "The matched trace is flat. Check the range does not only pick up a grid or axis line.";
        } else if (e instanceof InvalidInputException) {
            return "Try another image in PNG or JPEG format.";
        }
        return "Try different parameters or another image.";
    }
}

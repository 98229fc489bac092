package com.project.graph.digitizer;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.model;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.view;

@SpringBootTest
@AutoConfigureMockMvc
class DigitizationControllerTest {

    @Autowired MockMvc mvc;

    @Value("${app.upload.dir:uploads}")
    String uploadDir;

    @Test
    void homePage_isPublic() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(view().name("index"));
    }

    @Test
    void unauthenticated_isRedirectedToLogin() throws Exception {
        mvc.perform(get("/digitize"))
                .andExpect(status().is3xxRedirection())
                .andExpect(header().string("Location", containsString("/login")));
    }

    @Test
    @WithMockUser(username = "user", roles = {"USER"})
    void form_showsConfiguredRange() throws Exception {
        mvc.perform(get("/digitize"))
                .andExpect(status().isOk())
                .andExpect(view().name("digitize"))
                .andExpect(model().attribute("lower", "100,150,50"))
                .andExpect(model().attribute("upper", "140,255,255"));
    }

    @Test
    @WithMockUser(username = "user", roles = {"USER"})
    void digitize_flow_works() throws Exception {
        MockMultipartFile img = new MockMultipartFile(
                "file", "trace.png", "image/png", TestImages.png(TestImages.risingTrace(200, 100)));

        mvc.perform(multipart("/digitize").file(img).with(csrf()))
                .andExpect(status().isOk())
                .andExpect(view().name("result"))
                .andExpect(model().attribute("sampleCount", 190))
                .andExpect(model().attribute("degenerate", false))
                .andExpect(model().attribute("csvPath", startsWith("/uploads/")))
                .andExpect(model().attributeExists("plotPath", "originalPath", "preview"));
    }

    @Test
    @WithMockUser(username = "user", roles = {"USER"})
    void digitize_customRangeWithoutMatchShowsError() throws Exception {
        MockMultipartFile img = new MockMultipartFile(
                "file", "trace.png", "image/png", TestImages.png(TestImages.risingTrace(100, 60)));

        // red hues only
        mvc.perform(multipart("/digitize").file(img)
                        .param("lower", "0,150,50")
                        .param("upper", "10,255,255")
                        .with(csrf()))
                .andExpect(status().isOk())
                .andExpect(view().name("digitize"))
                .andExpect(model().attributeExists("error", "suggestion"))
                .andExpect(model().attribute("lower", "0,150,50"));
    }

    @Test
    @WithMockUser(username = "user", roles = {"USER"})
    void digitize_rejectsNonImageUpload() throws Exception {
        MockMultipartFile txt = new MockMultipartFile("file", "a.txt", "text/plain", "hello".getBytes());

        mvc.perform(multipart("/digitize").file(txt).with(csrf()))
                .andExpect(status().isOk())
                .andExpect(view().name("digitize"))
                .andExpect(model().attribute("error", containsString("Unsupported file type")));
    }

    @Test
    @WithMockUser(username = "user", roles = {"USER"})
    void digitize_undecodableImageIsNotStoredAndKeepsForm() throws Exception {
        Path root = Path.of(uploadDir);
        long before = fileCount(root);
        MockMultipartFile broken = new MockMultipartFile(
                "file", "broken.png", "image/png", "not really a png".getBytes());

        mvc.perform(multipart("/digitize").file(broken).with(csrf()))
                .andExpect(status().isOk())
                .andExpect(view().name("digitize"))
                .andExpect(model().attributeExists("error", "suggestion"))
                .andExpect(model().attribute("lower", "100,150,50"))
                .andExpect(model().attribute("upper", "140,255,255"));

        assertThat(fileCount(root)).isEqualTo(before);
    }

    private static long fileCount(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) return 0;
        try (Stream<Path> files = Files.list(dir)) {
            return files.count();
        }
    }
}

package com.companyintel.profiles.pipeline.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class CompanyApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void statusReportsLoadedCompanies() throws Exception {
        mockMvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.service").value("company-intel"))
            .andExpect(jsonPath("$.companiesLoaded").value(2));
    }

    @Test
    void companiesListsSummaryRows() throws Exception {
        mockMvc.perform(get("/api/companies"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(2))
            .andExpect(jsonPath("$.companies[0].domain").value("acme.com"))
            .andExpect(jsonPath("$.companies[1].sector").value("Healthcare"));
    }

    @Test
    void companyLookupNormalizesDomain() throws Exception {
        mockMvc.perform(get("/api/company/www.ACME.com"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.profile.domain").value("acme.com"))
            .andExpect(jsonPath("$.profile.company_name").value("Acme"))
            .andExpect(jsonPath("$.profile.sic_code").value("7372"));
    }

    @Test
    void unknownCompanyIsNotFound() throws Exception {
        mockMvc.perform(get("/api/company/unknown.example"))
            .andExpect(status().isNotFound());
    }

    @Test
    void refreshIsNotImplemented() throws Exception {
        mockMvc.perform(post("/api/company/acme.com/refresh"))
            .andExpect(status().isNotImplemented())
            .andExpect(jsonPath("$.error").value("not_implemented"));
    }

    @Test
    void pipelineRunIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/pipeline/run"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void pipelineRunWithoutInputDirectoryIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/pipeline/run"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("input_directory_missing"));
    }

    @Test
    void mergeWithoutRawFileIsNotFound() throws Exception {
        mockMvc.perform(post("/api/pipeline/merge"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("file_not_found"));
    }
}

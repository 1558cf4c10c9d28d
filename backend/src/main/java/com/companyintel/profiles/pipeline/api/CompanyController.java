package com.companyintel.profiles.pipeline.api;

import com.companyintel.profiles.pipeline.model.CompanyDetailView;
import com.companyintel.profiles.pipeline.model.CompanyListResponse;
import com.companyintel.profiles.pipeline.model.DirectoryStatusResponse;
import com.companyintel.profiles.pipeline.service.CompanyDirectoryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;
import static org.springframework.http.HttpStatus.NOT_IMPLEMENTED;

@RestController
@RequestMapping("/api")
public class CompanyController {
    private final CompanyDirectoryService directoryService;

    public CompanyController(CompanyDirectoryService directoryService) {
        this.directoryService = directoryService;
    }

    @GetMapping("/status")
    public DirectoryStatusResponse status() {
        return directoryService.status();
    }

    @GetMapping("/companies")
    public CompanyListResponse listCompanies() {
        return directoryService.list();
    }

    @GetMapping("/company/{domain}")
    public CompanyDetailView getCompany(@PathVariable("domain") String domain) {
        return directoryService.findDetail(domain)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Company not found: " + domain));
    }

    @PostMapping("/company/{domain}/refresh")
    public ResponseEntity<Map<String, String>> refreshCompany(@PathVariable("domain") String domain) {
        return ResponseEntity.status(NOT_IMPLEMENTED)
            .body(Map.of("error", "not_implemented", "domain", domain));
    }
}

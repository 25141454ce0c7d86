package com.vidnyan.tfguard.adapter.in.web;

import com.vidnyan.tfguard.application.port.in.PolicyCatalogUseCase;
import com.vidnyan.tfguard.application.port.in.PolicyCatalogUseCase.PolicyEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/policies")
@RequiredArgsConstructor
public class PolicyController {

    private final PolicyCatalogUseCase policyCatalogUseCase;

    @GetMapping
    public List<PolicyEntry> list(@RequestParam(required = false) String provider) {
        return policyCatalogUseCase.listPolicies(provider);
    }

    @PutMapping("/{code}/enabled")
    public PolicyEntry setEnabled(@PathVariable String code, @RequestBody ToggleRequest request) {
        return policyCatalogUseCase.setEnabled(code, request.enabled());
    }

    public record ToggleRequest(boolean enabled) {}
}

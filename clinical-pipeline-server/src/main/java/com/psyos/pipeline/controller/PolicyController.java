package com.psyos.pipeline.controller;

import com.psyos.pipeline.domain.AiPolicyEntity;
import com.psyos.pipeline.domain.PolicyUpdateRequest;
import com.psyos.pipeline.domain.TenantUserContext;
import com.psyos.pipeline.service.AccessTokenValidator;
import com.psyos.pipeline.service.PolicyService;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/policy")
public class PolicyController {

    private final AccessTokenValidator tokenValidator;
    private final PolicyService policyService;

    public PolicyController(AccessTokenValidator tokenValidator, PolicyService policyService) {
        this.tokenValidator = tokenValidator;
        this.policyService = policyService;
    }

    @GetMapping
    public Map<String, Object> get(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                   @RequestParam String scope,
                                   @RequestParam(required = false) String ownerUserId,
                                   @RequestParam(required = false) String conversationId) {
        TenantUserContext context = tokenValidator.authenticate(authorization);
        return Collections.singletonMap("item",
                policyService.getPolicy(context, scope, ownerUserId, conversationId).orElse(null));
    }

    @PostMapping
    public Map<String, Object> update(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                      @RequestBody PolicyUpdateRequest request) {
        TenantUserContext context = tokenValidator.authenticate(authorization);
        AiPolicyEntity policy = policyService.upsertPolicy(context, request);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("ok", true);
        response.put("policy", policy);
        return response;
    }
}

package com.psyos.pipeline.controller;

import com.psyos.pipeline.domain.TenantUserContext;
import com.psyos.pipeline.domain.WeeklyInsight;
import com.psyos.pipeline.service.AccessTokenValidator;
import com.psyos.pipeline.service.WeeklyInsightsService;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/insights")
public class InsightsController {

    private final AccessTokenValidator tokenValidator;
    private final WeeklyInsightsService weeklyInsightsService;

    public InsightsController(AccessTokenValidator tokenValidator, WeeklyInsightsService weeklyInsightsService) {
        this.tokenValidator = tokenValidator;
        this.weeklyInsightsService = weeklyInsightsService;
    }

    @GetMapping("/weekly")
    public Map<String, List<WeeklyInsight>> weekly(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam String conversationId,
            @RequestParam(required = false) String weekStart,
            @RequestParam(required = false) Integer weeks,
            @RequestParam(defaultValue = "false") boolean refresh) {
        TenantUserContext context = tokenValidator.authenticate(authorization);
        List<WeeklyInsight> items = weeklyInsightsService.weekly(context, conversationId,
                parseDay(weekStart), weeks, refresh);
        return Collections.singletonMap("items", items);
    }

    // Accepts a date or a full ISO timestamp; only the UTC day matters
    private static LocalDate parseDay(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return LocalDate.parse(trimmed.length() > 10 ? trimmed.substring(0, 10) : trimmed);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid weekStart", e);
        }
    }
}

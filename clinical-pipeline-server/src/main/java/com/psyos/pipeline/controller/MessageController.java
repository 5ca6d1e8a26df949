package com.psyos.pipeline.controller;

import com.psyos.pipeline.domain.DecryptedAttachment;
import com.psyos.pipeline.domain.MessageEntity;
import com.psyos.pipeline.domain.SendMessageRequest;
import com.psyos.pipeline.domain.TenantUserContext;
import com.psyos.pipeline.service.AccessTokenValidator;
import com.psyos.pipeline.service.MessageService;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Map;

@RestController
@RequestMapping("/api/messages")
public class MessageController {

    private final AccessTokenValidator tokenValidator;
    private final MessageService messageService;

    public MessageController(AccessTokenValidator tokenValidator, MessageService messageService) {
        this.tokenValidator = tokenValidator;
        this.messageService = messageService;
    }

    /**
     * POST /api/messages/send
     */
    @PostMapping("/send")
    public Map<String, Object> send(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                    @RequestBody SendMessageRequest request) {
        TenantUserContext context = tokenValidator.authenticate(authorization);
        MessageEntity message = messageService.send(context, request);
        return Map.of("ok", true, "messageId", message.getId());
    }

    @DeleteMapping("/{messageId}")
    public Map<String, Object> delete(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                      @PathVariable String messageId) {
        TenantUserContext context = tokenValidator.authenticate(authorization);
        messageService.delete(context, messageId);
        return Map.of("ok", true);
    }

    @GetMapping("/{messageId}/attachment")
    public ResponseEntity<byte[]> attachment(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                             @PathVariable String messageId) {
        TenantUserContext context = tokenValidator.authenticate(authorization);
        DecryptedAttachment attachment = messageService.readAttachment(context, messageId);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(attachment.getMime()))
                .contentLength(attachment.getBytes().length)
                .cacheControl(CacheControl.maxAge(Duration.ofMinutes(5)).cachePrivate())
                .body(attachment.getBytes());
    }
}

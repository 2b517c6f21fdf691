package com.phillippitts.streamtalker.presentation.controller;

import com.phillippitts.streamtalker.presentation.dto.ChatEventRequest;
import com.phillippitts.streamtalker.presentation.dto.EnqueueRequest;
import com.phillippitts.streamtalker.presentation.dto.EnqueueResponse;
import com.phillippitts.streamtalker.presentation.dto.ManualEnqueueRequest;
import com.phillippitts.streamtalker.presentation.dto.MessageView;
import com.phillippitts.streamtalker.presentation.dto.ValueRequest;
import com.phillippitts.streamtalker.presentation.dto.VoicesRequest;
import com.phillippitts.streamtalker.service.cache.CacheStats;
import com.phillippitts.streamtalker.service.cache.CompressionResult;
import com.phillippitts.streamtalker.service.chat.ChatMessageRouter;
import com.phillippitts.streamtalker.service.pipeline.PipelineCommands;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Operator control API for the pipeline.
 */
@RestController
@RequestMapping("/api")
class PipelineController {

    private static final Logger LOG = LogManager.getLogger(PipelineController.class);

    private final PipelineCommands commands;
    private final ChatMessageRouter router;

    PipelineController(PipelineCommands commands, ChatMessageRouter router) {
        this.commands = commands;
        this.router = router;
    }

    @PostMapping("/messages")
    ResponseEntity<EnqueueResponse> enqueue(@Valid @RequestBody EnqueueRequest request) {
        String username = request.username() == null ? "api" : request.username();
        String platform = request.platform() == null ? "Api" : request.platform();
        return ResponseEntity.ok(EnqueueResponse.from(commands.enqueue(request.text(), username, platform)));
    }

    @PostMapping("/messages/manual")
    ResponseEntity<EnqueueResponse> enqueueManual(@Valid @RequestBody ManualEnqueueRequest request) {
        PipelineCommands.ParameterOverrides overrides = new PipelineCommands.ParameterOverrides(
                request.model(), request.language(), request.speed(), request.temperature(),
                request.maxNewTokens(), request.repetitionPenalty());
        return ResponseEntity.ok(EnqueueResponse.from(
                commands.enqueueManual(request.text(), request.voice(), overrides)));
    }

    @GetMapping("/messages")
    List<MessageView> messages() {
        return commands.activeMessages().stream().map(MessageView::from).toList();
    }

    @GetMapping("/messages/failed")
    List<MessageView> failedMessages() {
        return commands.recentFailures().stream().map(MessageView::from).toList();
    }

    @PostMapping("/messages/{id}/requeue")
    ResponseEntity<EnqueueResponse> requeue(@PathVariable long id) {
        return ResponseEntity.ok(EnqueueResponse.from(commands.requeue(id)));
    }

    @PostMapping("/messages/requeue-failed")
    Map<String, Integer> requeueFailed() {
        return Map.of("requeued", commands.requeueAllFailed());
    }

    @PostMapping("/chat/messages")
    ResponseEntity<EnqueueResponse> chatMessage(@Valid @RequestBody ChatEventRequest event) {
        return ResponseEntity.ok(EnqueueResponse.from(
                router.onMessage(event.username(), event.platform(), event.text(), event.rewardId())));
    }

    @PostMapping("/chat/rewards")
    ResponseEntity<EnqueueResponse> chatReward(@Valid @RequestBody ChatEventRequest event) {
        return ResponseEntity.ok(EnqueueResponse.from(
                router.onReward(event.username(), event.platform(), event.text(), event.rewardId())));
    }

    @GetMapping("/status")
    PipelineCommands.PipelineStatus status() {
        return commands.status();
    }

    @PostMapping("/playback/skip")
    Map<String, Boolean> skipCurrent() {
        return Map.of("skipped", commands.skipCurrent());
    }

    @PostMapping("/playback/skip-all")
    Map<String, Integer> skipAll() {
        LOG.info("Skip-all requested");
        return Map.of("skipped", commands.skipAll());
    }

    @PutMapping("/playback/delay")
    ResponseEntity<Void> setDelay(@Valid @RequestBody ValueRequest request) {
        commands.setPlaybackDelay(request.value());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/playback/volume")
    ResponseEntity<Void> setGlobalVolume(@Valid @RequestBody ValueRequest request) {
        commands.setGlobalVolume(request.value());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/playback/volume/{voice}")
    ResponseEntity<Void> setVoiceVolume(@PathVariable String voice, @Valid @RequestBody ValueRequest request) {
        commands.setVoiceVolume(voice, request.value());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/synthesis/batch-size")
    ResponseEntity<Void> setBatchSize(@Valid @RequestBody ValueRequest request) {
        commands.setBatchSize(request.value());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/synthesis/skip-inference")
    Map<String, Boolean> skipInference() {
        return Map.of("accepted", commands.skipCurrentInference());
    }

    @GetMapping("/cache")
    CacheStats cacheStats() {
        return commands.cacheStats();
    }

    @DeleteMapping("/cache")
    Map<String, Integer> clearCache() {
        return Map.of("removed", commands.clearCache());
    }

    @PostMapping("/cache/compress")
    CompressionResult compressCache() {
        return commands.compressCache();
    }

    @PostMapping("/cache/remove-unused")
    Map<String, Integer> removeUnused() {
        return Map.of("removed", commands.removeUnusedCacheEntries());
    }

    @PutMapping("/cache/limit")
    ResponseEntity<Void> setCacheLimit(@Valid @RequestBody ValueRequest request) {
        commands.setCacheLimitMb(request.value());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/voices")
    ResponseEntity<Void> updateVoices(@Valid @RequestBody VoicesRequest request) {
        commands.updateKnownVoices(request.voices());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/voices/refresh")
    List<String> refreshVoices() {
        return commands.refreshKnownVoices();
    }
}

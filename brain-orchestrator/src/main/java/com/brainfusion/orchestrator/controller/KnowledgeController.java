package com.brainfusion.orchestrator.controller;

import com.brainfusion.common.knowledge.BrainLearningSummary;
import com.brainfusion.common.knowledge.CrossBrainKnowledgeStore;
import com.brainfusion.common.knowledge.KnowledgeInsights;
import com.brainfusion.common.model.KnowledgeItem;
import com.brainfusion.common.model.KnowledgeRequest;
import com.brainfusion.common.model.KnowledgeTransfer;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/knowledge")
public class KnowledgeController {

    private final CrossBrainKnowledgeStore knowledgeStore;

    public KnowledgeController(CrossBrainKnowledgeStore knowledgeStore) {
        this.knowledgeStore = knowledgeStore;
    }

    /** Shares an item under its {@code sourceBrain}. */
    @PostMapping("/share")
    public Mono<ResponseEntity<KnowledgeItem>> share(@RequestBody KnowledgeItem item) {
        return Mono.fromCallable(() -> {
            if (item.sourceBrain() == null || item.sourceBrain().isBlank()) {
                throw new IllegalArgumentException("sourceBrain is required to share knowledge");
            }
            if (item.knowledgeType() == null) {
                throw new IllegalArgumentException("knowledgeType is required to share knowledge");
            }
            return knowledgeStore.share(item.sourceBrain(), item);
        }).map(ResponseEntity::ok);
    }

    @PostMapping("/match")
    public Mono<ResponseEntity<List<KnowledgeItem>>> match(@RequestBody KnowledgeRequest request) {
        return Mono.fromCallable(() -> {
            if (request.knowledgeType() == null) {
                throw new IllegalArgumentException("knowledgeType is required to match knowledge");
            }
            return knowledgeStore.match(request);
        }).map(ResponseEntity::ok);
    }

    @PostMapping("/{knowledgeId}/transfer")
    public Mono<ResponseEntity<KnowledgeTransfer>> transfer(@PathVariable String knowledgeId,
                                                            @RequestParam String targetBrain) {
        return Mono.fromCallable(() -> knowledgeStore.transfer(knowledgeId, targetBrain))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/items")
    public Mono<ResponseEntity<List<KnowledgeItem>>> items() {
        return Mono.fromCallable(knowledgeStore::items).map(ResponseEntity::ok);
    }

    @GetMapping("/insights")
    public Mono<ResponseEntity<KnowledgeInsights>> insights() {
        return Mono.fromCallable(knowledgeStore::insights).map(ResponseEntity::ok);
    }

    @GetMapping("/brains/{brainId}/summary")
    public Mono<ResponseEntity<BrainLearningSummary>> summary(@PathVariable String brainId) {
        return Mono.fromCallable(() -> knowledgeStore.summaryFor(brainId)).map(ResponseEntity::ok);
    }
}

package com.gamefamily.controller;

import com.gamefamily.model.FamilyMember;
import com.gamefamily.model.LinkChange;
import com.gamefamily.model.LinkResult;
import com.gamefamily.model.RepAward;
import com.gamefamily.model.ReputationView;
import com.gamefamily.model.SubtreeDissolution;
import com.gamefamily.service.FamilyService;
import com.gamefamily.tenant.TenantContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST surface over {@link FamilyService}. Every call runs in the tenant named by the
 * {@code TENANT_ID} header; failures are rendered by {@link FamilyExceptionHandler}.
 */
@RestController
@RequestMapping("/api/families")
public class FamilyApiController {

    private static final String DEFAULT_REASON = "requested";

    private final FamilyService familyService;

    public FamilyApiController(FamilyService familyService) {
        this.familyService = familyService;
    }

    public record CreateMemberRequest(@Positive long characterId, @Positive int level, int world, int mapId) {}

    public record SyncMemberRequest(@Positive int level, int world, int mapId) {}

    public record AddJuniorRequest(
        @Positive long juniorId,
        int world,
        @Positive int seniorLevel,
        int seniorMap,
        @Positive int juniorLevel,
        int juniorMap
    ) {}

    public record AwardRepRequest(long amount, String source) {}

    public record DeductRepRequest(long amount, String reason) {}

    public record ActivityRequest(@NotBlank String type, long value) {}

    // ========== MEMBERS ==========

    @PostMapping("/members")
    public ResponseEntity<FamilyMember> createMember(@Valid @RequestBody CreateMemberRequest request) {
        FamilyMember member = familyService.createMember(request.characterId(), TenantContext.require(),
            request.level(), request.world(), request.mapId());
        return ResponseEntity.status(HttpStatus.CREATED).body(member);
    }

    @PutMapping("/members/{characterId}")
    public ResponseEntity<FamilyMember> ensureMember(@PathVariable long characterId,
                                                     @Valid @RequestBody SyncMemberRequest request) {
        return ResponseEntity.ok(familyService.ensureMemberExists(characterId, TenantContext.require(),
            request.level(), request.world(), request.mapId()));
    }

    @GetMapping("/{characterId}")
    public ResponseEntity<FamilyMember> getMember(@PathVariable long characterId) {
        return ResponseEntity.ok(familyService.getMember(characterId));
    }

    @GetMapping("/{characterId}/tree")
    public ResponseEntity<Map<String, Object>> getFamilyTree(@PathVariable long characterId) {
        List<FamilyMember> members = familyService.getFamilyTree(characterId);
        return ResponseEntity.ok(Map.of("characterId", characterId, "members", members));
    }

    @GetMapping("/{characterId}/reputation")
    public ResponseEntity<ReputationView> getReputation(@PathVariable long characterId) {
        return ResponseEntity.ok(familyService.getReputation(characterId));
    }

    // ========== LINKS ==========

    @PostMapping("/{characterId}/juniors")
    public ResponseEntity<LinkResult> addJunior(@PathVariable long characterId,
                                                @Valid @RequestBody AddJuniorRequest request) {
        LinkResult result = familyService.addJunior(characterId, request.juniorId(), request.world(),
            request.seniorLevel(), request.seniorMap(), request.juniorLevel(), request.juniorMap());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @DeleteMapping("/links/{characterId}")
    public ResponseEntity<LinkChange> breakLink(@PathVariable long characterId,
                                                @RequestParam(defaultValue = DEFAULT_REASON) String reason) {
        return ResponseEntity.ok(familyService.breakLink(characterId, reason));
    }

    @DeleteMapping("/{characterId}")
    public ResponseEntity<LinkChange> removeMember(@PathVariable long characterId,
                                                   @RequestParam(defaultValue = DEFAULT_REASON) String reason) {
        return ResponseEntity.ok(familyService.removeMember(characterId, reason));
    }

    @DeleteMapping("/{characterId}/subtree")
    public ResponseEntity<SubtreeDissolution> dissolveSubtree(@PathVariable long characterId,
                                                              @RequestParam(defaultValue = DEFAULT_REASON) String reason) {
        return ResponseEntity.ok(familyService.dissolveSubtree(characterId, reason));
    }

    // ========== REPUTATION ==========

    @PostMapping("/{characterId}/reputation/award")
    public ResponseEntity<ReputationView> awardRep(@PathVariable long characterId,
                                                   @RequestBody AwardRepRequest request) {
        FamilyMember member = familyService.awardRep(characterId, request.amount(), request.source());
        return ResponseEntity.ok(ReputationView.of(member));
    }

    @PostMapping("/{characterId}/reputation/deduct")
    public ResponseEntity<ReputationView> deductRep(@PathVariable long characterId,
                                                    @RequestBody DeductRepRequest request) {
        String reason = request.reason() == null ? DEFAULT_REASON : request.reason();
        FamilyMember member = familyService.deductRep(characterId, request.amount(), reason);
        return ResponseEntity.ok(ReputationView.of(member));
    }

    @PostMapping("/{characterId}/activities")
    public ResponseEntity<Map<String, Object>> registerActivity(@PathVariable long characterId,
                                                                @Valid @RequestBody ActivityRequest request) {
        Optional<RepAward> award = familyService.registerActivity(characterId, request.type(), request.value());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("characterId", characterId);
        response.put("awarded", award.map(a -> a.amount() > 0).orElse(false));
        award.ifPresent(a -> {
            response.put("seniorId", a.member().characterId());
            response.put("amount", a.amount());
            response.put("source", a.source());
        });
        return ResponseEntity.ok(response);
    }
}

package com.example.allocation.config;

import com.example.allocation.exception.AllocationException;
import com.example.allocation.model.AllocationEntry;
import com.example.allocation.model.AssignmentPhase;
import com.example.allocation.model.AuditDecision;
import com.example.allocation.model.AuditRecord;
import com.example.allocation.model.CandidateProfile;
import com.example.allocation.model.ChainVerification;
import com.example.allocation.model.FactorWeights;
import com.example.allocation.model.MatchList;
import com.example.allocation.model.NormalizedCandidate;
import com.example.allocation.model.NormalizedSlot;
import com.example.allocation.model.PairScore;
import com.example.allocation.model.QuotaPolicy;
import com.example.allocation.model.RoundRequest;
import com.example.allocation.model.RoundResult;
import com.example.allocation.model.SlotDefinition;
import com.example.allocation.model.UnmatchedReason;
import com.example.allocation.service.AllocationRoundService;
import com.example.allocation.service.AuditLedger;
import com.example.allocation.service.CandidateService;
import com.example.allocation.service.CompatibilityScorer;
import com.example.allocation.service.FeatureNormalizer;
import com.example.allocation.service.MatchFinder;
import com.example.allocation.service.SlotService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.modelcontextprotocol.common.McpTransportContext;
import io.modelcontextprotocol.server.McpStatelessServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.*;
import java.util.function.BiFunction;
import java.util.stream.Stream;

/**
 * Internship Allocation MCP surface
 *
 * <p>Designed for three consumer types:
 * <ul>
 *   <li><b>Programme Operators</b>: run allocation rounds, inspect round outcomes and fairness
 *       reports, record administrator overrides.</li>
 *   <li><b>Candidate Assistants</b>: explain to a single candidate why they were (or were not)
 *       placed, factor by factor.</li>
 *   <li><b>Auditors</b>: read an entity's decision history and verify the ledger's hash chain.</li>
 * </ul>
 *
 * <p>Transport context headers consumed:
 * <ul>
 *   <li>{@code X-Operator-ID}: the operator who is acting</li>
 *   <li>{@code X-Candidate-ID}: the candidate an assistant is acting for</li>
 *   <li>{@code X-Correlation-ID}: distributed trace propagation</li>
 * </ul>
 */
@Configuration(proxyBeanMethods = false)
public class AllocationMcpConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AllocationMcpConfiguration.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    // =========================================================================
    // TOOL ANNOTATION PRESETS
    // =========================================================================

    private static final McpSchema.ToolAnnotations READ_ONLY =
            new McpSchema.ToolAnnotations(null, true, false, true, false, false);

    private static final McpSchema.ToolAnnotations MUTATING =
            new McpSchema.ToolAnnotations(null, false, false, false, false, false);

    // =========================================================================
    // DOMAIN KNOWLEDGE CONSTANTS
    // =========================================================================

    private static final Map<String, Object> ENTITY_SCHEMAS = buildEntitySchemas();
    private static final Map<String, Object> REASON_CODES   = buildReasonCodes();

    // =========================================================================
    // TOOLS: 11 tools across 3 domains
    // =========================================================================

    @Bean
    public List<McpStatelessServerFeatures.SyncToolSpecification> allTools(
            AllocationRoundService rounds,
            AuditLedger ledger,
            CompatibilityScorer scorer,
            FeatureNormalizer normalizer,
            CandidateService candidates,
            SlotService slots,
            MatchFinder matchFinder,
            AllocationProperties properties) {
        return Stream.of(
                registryTools(candidates, slots, normalizer, scorer, matchFinder, properties),
                roundTools(rounds, candidates, slots, properties),
                auditTools(ledger)
        ).flatMap(List::stream).toList();
    }

    // ------------------------------------------------------------------ registry & scoring

    private List<McpStatelessServerFeatures.SyncToolSpecification> registryTools(
            CandidateService candidates, SlotService slots, FeatureNormalizer normalizer,
            CompatibilityScorer scorer, MatchFinder matchFinder, AllocationProperties properties) {
        return List.of(

            tool("listCandidates",
                "List Candidates",
                "List the candidates registered for the next allocation round, optionally filtered by " +
                "protected-attribute category. Category is used for quota accounting only, never for scoring.",
                READ_ONLY,
                schema(Map.of("category", prop("string", "Category filter, e.g. 'rural'")), List.of()),
                (ctx, req) -> {
                    String category = str(req, "category");
                    logCtx(ctx, "listCandidates", category);
                    List<CandidateProfile> result = category == null || category.isBlank()
                            ? candidates.findAll() : candidates.findByCategory(category);
                    Map<String, Object> view = new LinkedHashMap<>();
                    view.put("total", result.size());
                    view.put("categoryCounts", candidates.categoryCounts());
                    view.put("candidates", result);
                    return ok(toJson(view), view);
                }),

            tool("listSlots",
                "List Internship Slots",
                "List the internship slots on offer with capacity, sector and reserved seats per category.",
                READ_ONLY,
                schema(Map.of("sector", prop("string", "Sector filter, e.g. 'healthcare'")), List.of()),
                (ctx, req) -> {
                    String sector = str(req, "sector");
                    logCtx(ctx, "listSlots", sector);
                    List<SlotDefinition> result = sector == null || sector.isBlank()
                            ? slots.findAll() : slots.findBySector(sector);
                    Map<String, Object> view = new LinkedHashMap<>();
                    view.put("total", result.size());
                    view.put("totalCapacity", result.stream().mapToInt(SlotDefinition::capacity).sum());
                    view.put("slots", result);
                    return ok(toJson(view), view);
                }),

            tool("scorePair",
                "Score Candidate-Slot Pair",
                "Compute the compatibility score of one registered candidate against one slot, with the " +
                "per-factor breakdown. Uses the configured factor weights unless 'weights' is given.",
                READ_ONLY,
                schema(Map.of(
                    "candidateId", prop("string", "Candidate ID, e.g. C001"),
                    "slotId",      prop("string", "Slot ID, e.g. S001"),
                    "weights",     Map.of("type", "object",
                                          "additionalProperties", Map.of("type", "number"),
                                          "description", "Factor name to weight; weights must sum to 1")),
                    List.of("candidateId", "slotId")),
                (ctx, req) -> {
                    String cid = str(req, "candidateId");
                    String sid = str(req, "slotId");
                    logCtx(ctx, "scorePair", cid + "/" + sid);
                    Optional<CandidateProfile> candidate = candidates.findById(cid);
                    Optional<SlotDefinition> slot = slots.findById(sid);
                    if (candidate.isEmpty()) return err("Candidate not found: " + cid);
                    if (slot.isEmpty()) return err("Slot not found: " + sid);
                    try {
                        FactorWeights weights = req.arguments().get("weights") instanceof Map<?, ?> m
                                ? FactorWeights.of(numberMap(m)) : properties.getScoring().toWeights();
                        NormalizedCandidate nc = normalizer.normalizeCandidate(candidate.get());
                        NormalizedSlot ns = normalizer.normalizeSlot(slot.get());
                        PairScore score = scorer.scorePair(nc, ns, weights);
                        Map<String, Object> view = new LinkedHashMap<>();
                        view.put("score", score);
                        view.put("eligible", nc.eligibleFor(ns));
                        view.put("imputedCandidateFields", nc.features().imputedFields());
                        view.put("imputedSlotFields", ns.features().imputedFields());
                        return ok(toJson(view), view);
                    } catch (AllocationException e) {
                        return err("[" + e.getErrorCode() + "] " + e.getMessage());
                    } catch (IllegalArgumentException e) {
                        return err("Invalid weights: " + e.getMessage());
                    }
                }),

            tool("findMatches",
                "Find Matches for Candidate",
                "Rank every slot the candidate is eligible for by compatibility score, best first, with the " +
                "per-factor breakdown of each. Slots below the configured minimum score are left out. " +
                "This is advisory; seats are only given out by an allocation round.",
                READ_ONLY,
                schema(Map.of(
                    "candidateId", prop("string", "Candidate ID, e.g. C001"),
                    "limit",       prop("integer", "Maximum number of slots to return (default 10)"),
                    "weights",     Map.of("type", "object",
                                          "additionalProperties", Map.of("type", "number"),
                                          "description", "Factor name to weight; weights must sum to 1")),
                    List.of("candidateId")),
                (ctx, req) -> {
                    String cid = str(req, "candidateId");
                    int limit = intArg(req, "limit", MatchFinder.DEFAULT_LIMIT);
                    logCtx(ctx, "findMatches", cid);
                    try {
                        FactorWeights weights = req.arguments().get("weights") instanceof Map<?, ?> m
                                ? FactorWeights.of(numberMap(m)) : null;
                        Optional<MatchList> matches = matchFinder.findMatches(cid, limit, weights);
                        if (matches.isEmpty()) return err("Candidate not found: " + cid);
                        MatchList list = matches.get();
                        Map<String, Object> view = new LinkedHashMap<>();
                        view.put("candidateId", list.candidateId());
                        view.put("eligibleSlots", list.eligibleSlots());
                        view.put("returned", list.matches().size());
                        view.put("matches", list.matches());
                        return ok(toJson(view), view);
                    } catch (AllocationException e) {
                        return err("[" + e.getErrorCode() + "] " + e.getMessage());
                    } catch (IllegalArgumentException e) {
                        return err("Invalid request: " + e.getMessage());
                    }
                })
        );
    }

    // ------------------------------------------------------------------ rounds & fairness

    private List<McpStatelessServerFeatures.SyncToolSpecification> roundTools(
            AllocationRoundService rounds, CandidateService candidates, SlotService slots,
            AllocationProperties properties) {
        return List.of(

            tool("runAllocationRound",
                "Run Allocation Round",
                "Run one atomic allocation round over the registered candidates and slots (or the given " +
                "subsets). Returns the committed assignments, unmatched candidates with reasons, quota " +
                "waivers and the fairness verdict, or a structured failure. Nothing is committed on failure.",
                MUTATING,
                schema(Map.of(
                    "candidateIds",    Map.of("type", "array", "items", Map.of("type", "string"),
                                              "description", "Candidate subset; all registered when omitted"),
                    "slotIds",         Map.of("type", "array", "items", Map.of("type", "string"),
                                              "description", "Slot subset; all registered when omitted"),
                    "waiveInfeasible", prop("boolean", "Waive infeasible quota floors instead of failing the round")),
                    List.of()),
                (ctx, req) -> {
                    logCtx(ctx, "runAllocationRound", null);
                    List<String> cids = strList(req, "candidateIds");
                    List<String> sids = strList(req, "slotIds");
                    List<CandidateProfile> pool = cids.isEmpty() ? candidates.findAll() : candidates.findByIds(cids);
                    List<SlotDefinition> offered = sids.isEmpty() ? slots.findAll() : slots.findByIds(sids);
                    QuotaPolicy configured = properties.getQuotas().toPolicy();
                    QuotaPolicy policy = req.arguments().get("waiveInfeasible") instanceof Boolean b
                            ? new QuotaPolicy(configured.categories(), b) : configured;
                    RoundResult result = rounds.runRound(new RoundRequest(pool, offered, policy, null));
                    Map<String, Object> summary = roundSummary(result);
                    return result.succeeded()
                            ? ok(toJson(summary), summary)
                            : new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(toJson(summary))),
                                    true, summary, null);
                }),

            tool("getRoundSummary",
                "Get Round Summary",
                "Summary of a finished round: status, counts, assignments and failure details. " +
                "Defaults to the most recent committed round.",
                READ_ONLY,
                schema(Map.of("roundId", prop("string", "Round ID; latest committed round when omitted")), List.of()),
                (ctx, req) -> {
                    String roundId = str(req, "roundId");
                    logCtx(ctx, "getRoundSummary", roundId);
                    return resolveRound(rounds, roundId)
                            .map(r -> { Map<String, Object> s = roundSummary(r); return ok(toJson(s), s); })
                            .orElse(err(roundId == null ? "No committed round yet" : "Round not found: " + roundId));
                }),

            tool("getFairnessReport",
                "Get Fairness Report",
                "Per-category assignment rates, population baseline, disparities and flagged violations " +
                "for a committed round. Defaults to the most recent committed round.",
                READ_ONLY,
                schema(Map.of("roundId", prop("string", "Round ID; latest committed round when omitted")), List.of()),
                (ctx, req) -> {
                    String roundId = str(req, "roundId");
                    logCtx(ctx, "getFairnessReport", roundId);
                    return resolveRound(rounds, roundId)
                            .filter(RoundResult::succeeded)
                            .map(r -> ok(toJson(r.fairness()), r.fairness()))
                            .orElse(err("No committed round found" + (roundId == null ? "" : ": " + roundId)));
                }),

            tool("explainAssignment",
                "Explain Assignment",
                "Explain one candidate's outcome in a committed round: the slot, the phase (reserved quota " +
                "or open competition) and each factor's contribution, or the reason the candidate was unmatched.",
                READ_ONLY,
                schema(Map.of(
                    "candidateId", prop("string", "Candidate ID"),
                    "roundId",     prop("string", "Round ID; latest committed round when omitted")),
                    List.of("candidateId")),
                (ctx, req) -> {
                    String cid = str(req, "candidateId");
                    String roundId = str(req, "roundId");
                    logCtx(ctx, "explainAssignment", cid);
                    Optional<String> resolved = roundId != null ? Optional.of(roundId)
                            : rounds.latestCommittedRound().map(RoundResult::roundId);
                    return resolved.flatMap(r -> rounds.explain(r, cid))
                            .map(e -> ok(String.join("\n", e.narrative()), e))
                            .orElse(err("No explanation for candidate " + cid
                                    + (roundId == null ? " in the latest round" : " in round " + roundId)));
                })
        );
    }

    // ------------------------------------------------------------------ audit ledger

    private List<McpStatelessServerFeatures.SyncToolSpecification> auditTools(AuditLedger ledger) {
        return List.of(

            tool("getAuditHistory",
                "Get Audit History",
                "Every ledger record concerning a candidate or slot, in append order, including " +
                "corrections that supersede earlier decisions.",
                READ_ONLY,
                schema(Map.of("entityId", prop("string", "Candidate or slot ID")), List.of("entityId")),
                (ctx, req) -> {
                    String id = str(req, "entityId");
                    logCtx(ctx, "getAuditHistory", id);
                    if (id == null || id.isBlank()) return err("entityId is required");
                    List<AuditRecord> history = ledger.history(id);
                    if (history.isEmpty()) return ok("No audit records for " + id);
                    return ok(toJson(history), Map.of("entityId", id, "records", history));
                }),

            tool("verifyAuditChain",
                "Verify Audit Chain",
                "Recompute every record hash and link of the audit ledger and report the first broken record, if any.",
                READ_ONLY,
                schema(Map.of(), List.of()),
                (ctx, req) -> {
                    logCtx(ctx, "verifyAuditChain", null);
                    ChainVerification verification = ledger.verifyChain();
                    return ok(toJson(verification), verification);
                }),

            tool("recordCorrection",
                "Record Correction",
                "Record an administrator override of an earlier decision. The original record is kept; " +
                "the correction is appended to the chain and references it.",
                MUTATING,
                schema(Map.of(
                    "recordId", prop("string", "ID of the superseded audit record, e.g. AR-000004"),
                    "note",     prop("string", "What was overridden and why")),
                    List.of("recordId", "note")),
                (ctx, req) -> {
                    String recordId = str(req, "recordId");
                    String operator = ctx.get("X-Operator-ID") instanceof String o ? o : "unknown-operator";
                    logCtx(ctx, "recordCorrection", recordId);
                    try {
                        AuditRecord correction = ledger.appendCorrection(recordId,
                                "[" + operator + "] " + Objects.requireNonNullElse(str(req, "note"), ""));
                        return ok(toJson(correction), correction);
                    } catch (IllegalArgumentException e) {
                        return err(e.getMessage());
                    }
                })
        );
    }

    // =========================================================================
    // RESOURCES
    // =========================================================================

    @Bean
    public List<McpStatelessServerFeatures.SyncResourceSpecification> staticResources(
            CompatibilityScorer scorer, AllocationProperties properties) {
        return List.of(

            resource("allocation://policy/scoring",
                "Scoring Policy",
                "Compatibility factors with their rules and the active weights. Category never enters scoring.",
                "application/json",
                (ctx, req) -> {
                    Map<String, Object> policy = new LinkedHashMap<>();
                    policy.put("factors", scorer.factors().stream().map(f -> Map.of(
                            "name", f.name(),
                            "rule", f.rule(),
                            "weight", properties.getScoring().getWeights().getOrDefault(f.name(), 0.0))).toList());
                    policy.put("minimumScore", properties.getScoring().getMinimumScore());
                    policy.put("regionPartialCredit", properties.getScoring().getRegionPartialCredit());
                    policy.put("schemaVersion", properties.getFeatures().getSchemaVersion());
                    policy.put("tagVocabulary", properties.getFeatures().getTagVocabulary());
                    return jsonResource(req.uri(), toJson(policy));
                }),

            resource("allocation://policy/quotas",
                "Quota Policy",
                "Per-category floor and ceiling fractions, waivability, and the fairness tolerance.",
                "application/json",
                (ctx, req) -> {
                    Map<String, Object> policy = new LinkedHashMap<>();
                    policy.put("categories", properties.getQuotas().toPolicy().categories());
                    policy.put("waiveInfeasible", properties.getQuotas().isWaiveInfeasible());
                    policy.put("fairness", properties.getFairness().toPolicy());
                    policy.put("floorRule", "max(reserved seats, ceil(minFraction x capacity))");
                    policy.put("ceilingRule", "floor(maxFraction x capacity)");
                    return jsonResource(req.uri(), toJson(policy));
                }),

            resource("allocation://schema/candidate",
                "Candidate Schema",
                "Documented field schema for the CandidateProfile entity.",
                "application/json",
                (ctx, req) -> jsonResource(req.uri(), toJson(ENTITY_SCHEMAS.get("CandidateProfile")))),

            resource("allocation://schema/slot",
                "Slot Schema",
                "Documented field schema for the SlotDefinition entity.",
                "application/json",
                (ctx, req) -> jsonResource(req.uri(), toJson(ENTITY_SCHEMAS.get("SlotDefinition")))),

            resource("allocation://catalog/reason-codes",
                "Reason Code Catalog",
                "Unmatched reasons, audit decisions, assignment phases and round error codes.",
                "application/json",
                (ctx, req) -> jsonResource(req.uri(), toJson(REASON_CODES)))
        );
    }

    @Bean
    public List<McpStatelessServerFeatures.SyncResourceTemplateSpecification> resourceTemplates(
            AllocationRoundService rounds) {
        return List.of(

            template("allocation://rounds/{roundId}/summary",
                "Round Summary",
                "Outcome summary of a finished allocation round.",
                "application/json",
                (ctx, req) -> {
                    String id = seg(req.uri(), "allocation://rounds/", "/summary");
                    return rounds.findRound(id)
                            .map(r -> jsonResource(req.uri(), toJson(roundSummary(r))))
                            .orElseThrow(() -> new IllegalArgumentException("Round not found: " + id));
                })
        );
    }

    // =========================================================================
    // VIEW BUILDERS
    // =========================================================================

    private static Optional<RoundResult> resolveRound(AllocationRoundService rounds, String roundId) {
        return roundId == null || roundId.isBlank() ? rounds.latestCommittedRound() : rounds.findRound(roundId);
    }

    private static Map<String, Object> roundSummary(RoundResult result) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("roundId", result.roundId());
        view.put("status", result.status().name());
        view.put("completedAt", result.completedAt());
        view.put("exclusions", result.exclusions());
        if (!result.succeeded()) {
            view.put("failure", result.failure());
            return view;
        }
        view.put("inputFingerprint", result.inputFingerprint());
        view.put("assignedCount", result.allocation().entries().size());
        view.put("unmatchedCount", result.allocation().unmatched().size());
        view.put("totalScore", result.allocation().totalScore());
        view.put("assignments", result.allocation().entries().stream().map(AllocationMcpConfiguration::assignmentView).toList());
        view.put("unmatched", result.allocation().unmatched());
        view.put("waivers", result.allocation().waivers());
        view.put("fairnessPassed", result.fairness().passed());
        view.put("fairnessViolations", result.fairness().violations());
        return view;
    }

    private static Map<String, Object> assignmentView(AllocationEntry entry) {
        return Map.of(
                "candidateId", entry.candidateId(),
                "slotId",      entry.slotId(),
                "category",    entry.category(),
                "phase",       entry.phase().name(),
                "score",       entry.score().composite());
    }

    // =========================================================================
    // BUILDER HELPERS
    // =========================================================================

    @FunctionalInterface
    interface ToolHandler {
        McpSchema.CallToolResult handle(McpTransportContext ctx, McpSchema.CallToolRequest req);
    }

    private McpStatelessServerFeatures.SyncToolSpecification tool(
            String name, String title, String description,
            McpSchema.ToolAnnotations annotations, McpSchema.JsonSchema inputSchema,
            ToolHandler handler) {
        return McpStatelessServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name(name).title(title).description(description)
                        .inputSchema(inputSchema).annotations(annotations).build())
                .callHandler(handler::handle)
                .build();
    }

    private McpStatelessServerFeatures.SyncResourceSpecification resource(
            String uri, String name, String description, String mimeType,
            BiFunction<McpTransportContext, McpSchema.ReadResourceRequest, McpSchema.ReadResourceResult> handler) {
        return new McpStatelessServerFeatures.SyncResourceSpecification(
                McpSchema.Resource.builder().uri(uri).name(name).description(description).mimeType(mimeType).build(),
                handler);
    }

    private McpStatelessServerFeatures.SyncResourceTemplateSpecification template(
            String uriTemplate, String name, String description, String mimeType,
            BiFunction<McpTransportContext, McpSchema.ReadResourceRequest, McpSchema.ReadResourceResult> handler) {
        return new McpStatelessServerFeatures.SyncResourceTemplateSpecification(
                McpSchema.ResourceTemplate.builder()
                        .uriTemplate(uriTemplate).name(name).description(description).mimeType(mimeType).build(),
                handler);
    }

    // =========================================================================
    // CALL RESULT HELPERS
    // =========================================================================

    private McpSchema.CallToolResult ok(String text) {
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(text)), false);
    }

    private McpSchema.CallToolResult ok(String text, Object structured) {
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(text)), false, structured, null);
    }

    private static McpSchema.CallToolResult err(String message) {
        return new McpSchema.CallToolResult(List.of(new McpSchema.TextContent(message)), true);
    }

    private McpSchema.ReadResourceResult jsonResource(String uri, String json) {
        return new McpSchema.ReadResourceResult(
                List.of(new McpSchema.TextResourceContents(uri, "application/json", json)));
    }

    // =========================================================================
    // SCHEMA & ARGUMENT HELPERS
    // =========================================================================

    private static McpSchema.JsonSchema schema(Map<String, Object> properties, List<String> required) {
        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    private static Map<String, Object> prop(String type, String description) {
        return Map.of("type", type, "description", description);
    }

    private static String str(McpSchema.CallToolRequest req, String key) {
        Object v = req.arguments().get(key);
        return v instanceof String s ? s : null;
    }

    private static int intArg(McpSchema.CallToolRequest req, String key, int def) {
        Object v = req.arguments().get(key);
        return v instanceof Number n ? n.intValue() : def;
    }

    private static List<String> strList(McpSchema.CallToolRequest req, String key) {
        return req.arguments().get(key) instanceof List<?> l
                ? l.stream().filter(String.class::isInstance).map(String.class::cast).toList()
                : List.of();
    }

    private static Map<String, Double> numberMap(Map<?, ?> raw) {
        Map<String, Double> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (!(v instanceof Number n)) {
                throw new IllegalArgumentException("Weight for " + k + " is not a number: " + v);
            }
            out.put(String.valueOf(k), n.doubleValue());
        });
        return out;
    }

    /** Extracts the variable segment from a resolved URI template. */
    private static String seg(String uri, String prefix, String suffix) {
        String after = uri.startsWith(prefix) ? uri.substring(prefix.length()) : uri;
        return !suffix.isEmpty() && after.contains(suffix)
                ? after.substring(0, after.indexOf(suffix)) : after;
    }

    private void logCtx(McpTransportContext ctx, String tool, String subject) {
        String actor = ctx.get("X-Operator-ID")  instanceof String o ? "operator=" + o
                     : ctx.get("X-Candidate-ID") instanceof String c ? "candidate=" + c : "actor=unknown";
        String corr  = ctx.get("X-Correlation-ID") instanceof String c ? c : "-";
        log.info("[{}] [corr={}] tool={} subject={}", actor, corr, tool, subject);
    }

    private String toJson(Object obj) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            return obj.toString();
        }
    }

    // =========================================================================
    // STATIC KNOWLEDGE BUILDERS
    // =========================================================================

    private static Map<String, Object> fld(String type, String description) {
        return Map.of("type", type, "description", description);
    }

    private static Map<String, Object> entitySchema(String entity, String description,
                                                     Map<String, Object> fields) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("entity", entity);
        schema.put("description", description);
        schema.put("fields", fields);
        return schema;
    }

    private static Map<String, Object> buildEntitySchemas() {
        Map<String, Object> schemas = new LinkedHashMap<>();

        Map<String, Object> features = new LinkedHashMap<>();
        features.put("schemaVersion",   fld("integer",  "Must equal allocation.features.schema-version"));
        features.put("skills",          fld("number[]", "Skill embedding; length = skill-dimensions, missing → zero vector"));
        features.put("experienceYears", fld("number",   "Rescaled by max-experience-years; missing → midpoint"));
        features.put("rating",          fld("number",   "Academic/host rating, rescaled by max-rating; missing → midpoint"));
        features.put("tags",            fld("string[]", "Sector/interest tags; unknown tags map to the unknown bucket"));
        features.put("location",        fld("string",   "City; compared case-insensitively"));
        features.put("region",          fld("string",   "State/region; partial geography credit"));

        Map<String, Object> candidateFields = new LinkedHashMap<>();
        candidateFields.put("id",          fld("string",   "Unique ID, e.g. C001"));
        candidateFields.put("name",        fld("string",   "Display name"));
        candidateFields.put("submittedAt", fld("datetime", "Application timestamp; earlier wins score ties"));
        candidateFields.put("category",    fld("string",   "Protected-attribute category, quota accounting only"));
        candidateFields.put("features",    fld("RawFeatures", "Raw features; fetched from the extraction provider when absent"));
        candidateFields.put("eligibility", fld("Eligibility", "Acceptable regions (empty = any) and excluded sectors"));
        Map<String, Object> candidate = entitySchema("CandidateProfile",
                "An applicant waiting for placement in an allocation round.", candidateFields);
        candidate.put("rawFeatures", features);
        schemas.put("CandidateProfile", candidate);

        Map<String, Object> slotFields = new LinkedHashMap<>();
        slotFields.put("id",             fld("string",      "Unique ID, e.g. S001"));
        slotFields.put("organization",   fld("string",      "Host organization"));
        slotFields.put("title",          fld("string",      "Internship title"));
        slotFields.put("capacity",       fld("integer",     "Seats offered, >= 1"));
        slotFields.put("sector",         fld("string",      "Sector, matched against candidates' excluded sectors"));
        slotFields.put("features",       fld("RawFeatures", "Requirement features in the same schema as candidates"));
        slotFields.put("reservedQuotas", fld("map<string,integer>", "Seats reserved per category"));
        Map<String, Object> slot = entitySchema("SlotDefinition",
                "An internship offering with a fixed number of seats.", slotFields);
        slot.put("rawFeatures", features);
        schemas.put("SlotDefinition", slot);

        return Collections.unmodifiableMap(schemas);
    }

    private static Map<String, Object> buildReasonCodes() {
        Map<String, Object> codes = new LinkedHashMap<>();
        Map<String, String> unmatched = new LinkedHashMap<>();
        for (UnmatchedReason reason : UnmatchedReason.values()) {
            unmatched.put(reason.name(), reason.description());
        }
        codes.put("unmatchedReasons", unmatched);
        codes.put("auditDecisions", Arrays.stream(AuditDecision.values()).map(Enum::name).toList());
        codes.put("assignmentPhases", Arrays.stream(AssignmentPhase.values()).map(Enum::name).toList());
        Map<String, String> errors = new LinkedHashMap<>();
        errors.put("VALIDATION_ERROR", "Entity failed feature validation and was excluded from the round");
        errors.put("EXTRACTION_ERROR", "Features could not be fetched after retries; entity excluded");
        errors.put("FACTOR_ERROR",     "A scoring factor could not be computed; degraded to 0 for that pair");
        errors.put("QUOTA_INFEASIBLE", "Quota floors cannot fit a slot's capacity; round failed unless waived");
        errors.put("SOLVER_ERROR",     "Assignment could not satisfy hard constraints; round failed");
        errors.put("INPUT_CHANGED",    "Round inputs changed while the round was running; round failed");
        errors.put("AUDIT_ERROR",      "Audit records could not be written; round failed and was not stored");
        errors.put("ROUND_CANCELLED",  "Round cancelled before commit");
        errors.put("INTERNAL_ERROR",   "Unexpected failure; round failed");
        codes.put("errorCodes", errors);
        return Collections.unmodifiableMap(codes);
    }
}

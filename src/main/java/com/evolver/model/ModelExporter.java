package com.evolver.model;

import com.evolver.condition.ConditionSpec;
import com.evolver.exception.EvolverException;
import com.evolver.patch.EditKind;
import com.evolver.patch.PatchEdit;
import com.evolver.patch.PatchProposal;
import com.evolver.patch.ProposalSource;
import com.evolver.patch.Provenance;
import com.evolver.rule.Rule;
import com.evolver.rule.RuleKind;
import com.evolver.rule.RuleMetadata;
import com.evolver.rule.RuleStatus;
import com.evolver.simulation.WorldModelDiff;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON export of the full model: every version with its parent, creation time and rules,
 * the current pointer and the audit log. {@link #read} rebuilds an equivalent model.
 * Timestamps are written as epoch milliseconds.
 */
public class ModelExporter {

    private static final Logger log = LoggerFactory.getLogger(ModelExporter.class);

    private final ObjectMapper objectMapper;

    public ModelExporter() {
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson(WorldModel model) {
        try {
            return objectMapper.writeValueAsString(toDocument(model));
        } catch (JsonProcessingException e) {
            throw new EvolverException("Failed to export world model", e);
        }
    }

    public void write(WorldModel model, Path path) {
        try {
            Files.writeString(path, toJson(model));
            log.info("Exported world model ({} versions, current {}) to {}",
                    model.versionCount(), model.currentVersionId(), path);
        } catch (IOException e) {
            throw new EvolverException("Failed to write world model to " + path, e);
        }
    }

    public WorldModel fromJson(String json) {
        try {
            return toModel(objectMapper.readValue(json, ModelDocument.class));
        } catch (JsonProcessingException e) {
            throw new EvolverException("Malformed world model export", e);
        }
    }

    public WorldModel read(Path path) {
        try {
            return fromJson(Files.readString(path));
        } catch (IOException e) {
            throw new EvolverException("Failed to read world model from " + path, e);
        }
    }

    // Documents

    public record ModelDocument(String currentVersion, long exportedAt, List<VersionDocument> versions,
                                List<AuditDocument> audit) {
    }

    public record VersionDocument(String versionId, String parentId, long createdAt, List<RuleDocument> rules) {
    }

    public record RuleDocument(String id, RuleKind kind, String action, List<ConditionSpec> conditions,
                               Map<String, Object> requires, List<String> predecessors, String description,
                               MetadataDocument metadata) {
    }

    public record MetadataDocument(long successCount, long failureCount, double confidence, RuleStatus status,
                                   long lastUpdated, int belowThresholdCycles) {
    }

    public record AuditDocument(AuditKind kind, String versionId, String fromVersion, ProposalDocument proposal,
                                WorldModelDiff diff, String note, long timestamp) {
    }

    public record ProposalDocument(String id, ProposalSource source, String taskId, String versionId,
                                   String rationale, List<EditDocument> edits) {
    }

    public record EditDocument(EditKind kind, String ruleId, ConditionSpec condition, List<String> predecessors,
                               RuleDocument rule) {
    }

    // Mapping

    private ModelDocument toDocument(WorldModel model) {
        List<VersionDocument> versions = new ArrayList<>();
        for (WorldModelSnapshot snapshot : model.versions()) {
            versions.add(new VersionDocument(snapshot.versionId(), snapshot.parentId(),
                    snapshot.createdAt().toEpochMilli(), snapshot.rules().stream().map(ModelExporter::ruleDocument).toList()));
        }
        List<AuditDocument> audit = new ArrayList<>();
        for (AuditRecord record : model.auditLog()) {
            audit.add(new AuditDocument(record.kind(), record.versionId(), record.fromVersion(),
                    record.proposal() == null ? null : proposalDocument(record.proposal()),
                    record.diff(), record.note(), record.timestamp().toEpochMilli()));
        }
        return new ModelDocument(model.currentVersionId(), Instant.now().toEpochMilli(), versions, audit);
    }

    private static RuleDocument ruleDocument(Rule rule) {
        RuleMetadata m = rule.metadata();
        return new RuleDocument(rule.id(), rule.kind(), rule.action(), rule.conditions(), rule.requires(),
                rule.predecessors(), rule.description(),
                new MetadataDocument(m.successCount(), m.failureCount(), m.confidence(), m.status(),
                        m.lastUpdated() == null ? 0 : m.lastUpdated().toEpochMilli(), m.belowThresholdCycles()));
    }

    private static ProposalDocument proposalDocument(PatchProposal proposal) {
        List<EditDocument> edits = new ArrayList<>();
        for (PatchEdit edit : proposal.edits()) {
            edits.add(new EditDocument(edit.kind(), edit.ruleId(), edit.condition(), edit.predecessors(),
                    edit.rule() == null ? null : ruleDocument(edit.rule())));
        }
        Provenance p = proposal.provenance();
        return new ProposalDocument(proposal.id(), p.source(), p.taskId(), p.versionId(), proposal.rationale(), edits);
    }

    private static WorldModel toModel(ModelDocument document) {
        if (document.versions() == null || document.versions().isEmpty()) {
            throw new EvolverException("World model export has no versions");
        }
        List<WorldModelSnapshot> snapshots = new ArrayList<>();
        for (VersionDocument version : document.versions()) {
            snapshots.add(new WorldModelSnapshot(version.versionId(), version.parentId(),
                    version.rules().stream().map(ModelExporter::toRule).toList(),
                    Instant.ofEpochMilli(version.createdAt())));
        }
        List<AuditRecord> audit = new ArrayList<>();
        if (document.audit() != null) {
            for (AuditDocument record : document.audit()) {
                audit.add(new AuditRecord(record.kind(), record.versionId(), record.fromVersion(),
                        record.proposal() == null ? null : toProposal(record.proposal()),
                        record.diff(), record.note(), Instant.ofEpochMilli(record.timestamp())));
            }
        }
        return WorldModel.restore(snapshots, document.currentVersion(), audit);
    }

    private static Rule toRule(RuleDocument rule) {
        MetadataDocument m = rule.metadata();
        RuleMetadata metadata = new RuleMetadata(m.successCount(), m.failureCount(), m.confidence(), m.status(),
                Instant.ofEpochMilli(m.lastUpdated()), m.belowThresholdCycles());
        return new Rule(rule.id(), rule.kind(), rule.action(), rule.conditions(), rule.requires(),
                rule.predecessors(), rule.description(), metadata);
    }

    private static PatchProposal toProposal(ProposalDocument proposal) {
        List<PatchEdit> edits = new ArrayList<>();
        for (EditDocument edit : proposal.edits()) {
            edits.add(new PatchEdit(edit.kind(), edit.ruleId(), edit.condition(), edit.predecessors(),
                    edit.rule() == null ? null : toRule(edit.rule())));
        }
        return new PatchProposal(proposal.id(), edits,
                new Provenance(proposal.source(), proposal.taskId(), proposal.versionId()), proposal.rationale());
    }
}

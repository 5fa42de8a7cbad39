package com.structural.cbr.io;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.structural.cbr.api.DofKey;
import com.structural.cbr.api.ReductionWarning;
import com.structural.cbr.reduction.InterfaceNode;
import com.structural.cbr.reduction.ReducedModel;
import com.structural.cbr.util.MatrixOps;

/**
 * Writes a {@link ReducedModel} as a JSON bundle for the downstream consumer.
 */
public final class ReducedModelWriter {
    private static final Logger log = LogManager.getLogger(ReducedModelWriter.class);

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public ReducedModelDocument toDocument(String name, ReducedModel reduced) {
        ReducedModelDocument doc = new ReducedModelDocument();
        doc.setName(name);

        ReducedModelDocument.Statistics stats = new ReducedModelDocument.Statistics();
        stats.setOriginalSize(reduced.originalSize());
        stats.setReducedSize(reduced.reducedSize());
        stats.setMasterCount(reduced.masterCount());
        stats.setSlaveCount(reduced.slaveCount());
        stats.setModeCount(reduced.modeCount());
        stats.setReductionRatio(reduced.reductionRatio());
        stats.setStiffnessRcond(reduced.stiffnessRcond());
        stats.setPseudoInverseUsed(reduced.isPseudoInverseUsed());
        doc.setStatistics(stats);

        doc.setDofLabels(reduced.dofs().labels());
        doc.setRowLabels(reduced.rowDofs().stream().mapToLong(DofKey::encode).toArray());
        doc.setMasterIndices(reduced.masterIndices());
        doc.setSlaveIndices(reduced.slaveIndices());

        List<ReducedModelDocument.InterfaceNodeDef> nodes = new ArrayList<>();
        for (InterfaceNode n : reduced.interfaceNodes()) {
            ReducedModelDocument.InterfaceNodeDef d = new ReducedModelDocument.InterfaceNodeDef();
            d.setId(n.nodeId());
            d.setX(n.x());
            d.setY(n.y());
            d.setZ(n.z());
            d.setDofCount(n.dofCount());
            nodes.add(d);
        }
        doc.setInterfaceNodes(nodes);

        doc.setFrequencies(reduced.frequencies());
        doc.setModalOutcome(reduced.modes().outcome().name());
        doc.setStiffness(MatrixOps.toArray(reduced.stiffness()));
        doc.setMass(MatrixOps.toArray(reduced.mass()));
        doc.setTransformation(MatrixOps.toArray(reduced.transformation()));
        doc.setGuyanStiffness(MatrixOps.toArray(reduced.guyanStiffness()));
        doc.setGuyanMass(MatrixOps.toArray(reduced.guyanMass()));
        doc.setGuyanTransformation(MatrixOps.toArray(reduced.guyanTransformation()));
        doc.setWarnings(reduced.warnings().stream().map(ReductionWarning::toString).toList());
        return doc;
    }

    public String toJson(String name, ReducedModel reduced) {
        try {
            return mapper.writeValueAsString(toDocument(name, reduced));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize reduced model '" + name + "'", e);
        }
    }

    public void write(String name, ReducedModel reduced, OutputStream out) throws IOException {
        mapper.writeValue(out, toDocument(name, reduced));
    }

    public void write(String name, ReducedModel reduced, Path path) throws IOException {
        if (path.getParent() != null)
            Files.createDirectories(path.getParent());
        try (OutputStream out = Files.newOutputStream(path)) {
            write(name, reduced, out);
        }
        log.info("Wrote reduced model '{}' ({}x{}) to {}", name, reduced.reducedSize(), reduced.reducedSize(), path);
    }

    /** Reads back a bundle written by this class. */
    public ReducedModelDocument read(Path path) throws IOException {
        return mapper.readValue(path.toFile(), ReducedModelDocument.class);
    }
}

/*
 * QCircuit — Quantum Circuit Simulation Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.qcircuit.core.storage;

import ai.evacortex.qcircuit.core.circuit.GateRequest;
import ai.evacortex.qcircuit.core.circuit.QuantumCircuit;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * JSON file holding circuit definitions, one entry per circuit with its operations in
 * request form. Reading never validates; callers feed the operations back through the
 * registry, which does.
 */
public class CircuitSnapshotStore {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CircuitSnapshot(String name, int numQubits, int numClbits, List<GateRequest> operations) {

        public static CircuitSnapshot of(QuantumCircuit circuit) {
            return new CircuitSnapshot(circuit.name(), circuit.numQubits(), circuit.numClbits(),
                    circuit.operations().stream().map(GateRequest::fromOperation).toList());
        }
    }

    private final Path file;
    private final ObjectMapper mapper;

    public CircuitSnapshotStore(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.mapper = new ObjectMapper();
    }

    public Path file() {
        return file;
    }

    /**
     * Replaces the file contents with the given circuits. Written to a sibling temp file
     * first and moved into place.
     */
    public void write(Collection<QuantumCircuit> circuits) {
        List<CircuitSnapshot> snapshots = circuits.stream().map(CircuitSnapshot::of).toList();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, snapshots);
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write circuit snapshot " + file, e);
        }
    }

    /**
     * @return stored snapshots, or an empty list when the file does not exist
     */
    public List<CircuitSnapshot> read() {
        if (!Files.exists(file)) return List.of();
        try (InputStream in = Files.newInputStream(file)) {
            return mapper.readValue(in, new TypeReference<List<CircuitSnapshot>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read circuit snapshot " + file, e);
        }
    }
}

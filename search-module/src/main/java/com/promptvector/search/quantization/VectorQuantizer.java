package com.promptvector.search.quantization;

import com.promptvector.search.index.FlatVectorIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 8-bit scalar quantization of stored vectors, kept for memory accounting.
 * Full-precision vectors in {@link FlatVectorIndex} stay authoritative for similarity.
 * <p>
 * Parameters are calibrated on the first encode and afterwards only by an explicit
 * {@link #recalibrate()}; codes produced in between use stale parameters.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VectorQuantizer {

    private final FlatVectorIndex flatIndex;

    private final Map<String, byte[]> codes = new ConcurrentHashMap<>();

    private volatile QuantizationParameters parameters;

    /**
     * Квантовать вектор документа и сохранить код
     */
    public void encode(String documentId, float[] vector) {
        QuantizationParameters current = parameters;
        if (current == null) {
            current = calibrate();
            if (current == null) {
                return;
            }
        }
        codes.put(documentId, quantize(vector, current));
    }

    public byte[] quantize(float[] vector) {
        QuantizationParameters current = parameters;
        if (current == null) {
            throw new IllegalStateException("Quantizer is not calibrated");
        }
        return quantize(vector, current);
    }

    /**
     * Recomputes scale/offset from the min/max over all stored vector components
     * and re-encodes every stored document.
     * @return new parameters, empty when the corpus is empty
     */
    public synchronized Optional<QuantizationParameters> recalibrate() {
        QuantizationParameters updated = calibrate();
        if (updated == null) {
            return Optional.empty();
        }
        Map<String, float[]> vectors = flatIndex.snapshot();
        codes.keySet().retainAll(vectors.keySet());
        vectors.forEach((id, vector) -> codes.put(id, quantize(vector, updated)));
        log.info("Recalibrated quantizer: scale={}, offset={}, {} vectors re-encoded",
            updated.scale(), updated.offset(), vectors.size());
        return Optional.of(updated);
    }

    public boolean remove(String documentId) {
        return codes.remove(documentId) != null;
    }

    /**
     * Drops codes of documents outside the given id set.
     * @return number of dropped codes
     */
    public int retainOnly(Set<String> liveIds) {
        int before = codes.size();
        codes.keySet().retainAll(liveIds);
        return before - codes.size();
    }

    public Optional<byte[]> codeOf(String documentId) {
        return Optional.ofNullable(codes.get(documentId));
    }

    public Optional<QuantizationParameters> parameters() {
        return Optional.ofNullable(parameters);
    }

    public int size() {
        return codes.size();
    }

    /** Объём памяти под коды, байт */
    public long memoryBytes() {
        long total = 0;
        for (byte[] code : codes.values()) {
            total += code.length;
        }
        return total;
    }

    public synchronized void clear() {
        codes.clear();
        parameters = null;
    }

    private synchronized QuantizationParameters calibrate() {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (float[] vector : flatIndex.snapshot().values()) {
            for (float value : vector) {
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
        }
        if (min == Double.POSITIVE_INFINITY) {
            return null;
        }
        parameters = QuantizationParameters.fromRange(min, max);
        return parameters;
    }

    private static byte[] quantize(float[] vector, QuantizationParameters params) {
        byte[] quantized = new byte[vector.length];
        for (int i = 0; i < vector.length; i++) {
            long code = Math.round((vector[i] - params.offset()) / params.scale());
            quantized[i] = (byte) Math.max(0, Math.min(QuantizationParameters.LEVELS, code));
        }
        return quantized;
    }
}

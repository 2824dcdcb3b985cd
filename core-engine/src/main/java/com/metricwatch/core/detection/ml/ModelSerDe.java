package com.metricwatch.core.detection.ml;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.metricwatch.core.detection.ml.state.ModelState;
import com.metricwatch.core.error.ModelPersistenceException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Reads and writes fitted models as JSON {@link ModelState} artifacts.
 *
 * <p>
 * Writes go to a temporary file in the target directory that is then moved
 * over the target, so a reader never sees a half-written artifact.
 * </p>
 */
final class ModelSerDe {

    private final ModelStateMapper mapper;
    private final ObjectMapper objectMapper;

    ModelSerDe() {
        this(new ModelStateMapper(), defaultObjectMapper());
    }

    ModelSerDe(ModelStateMapper mapper, ObjectMapper objectMapper) {
        this.mapper = mapper;
        this.objectMapper = objectMapper;
    }

    static ObjectMapper defaultObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return objectMapper;
    }

    String toJson(FittedModel fitted) {
        try {
            return objectMapper.writeValueAsString(mapper.toState(fitted));
        } catch (JsonProcessingException e) {
            throw new ModelPersistenceException("Failed to serialize model state", e);
        }
    }

    /**
     * Parse an artifact without validating it.
     */
    ModelState readState(String json) {
        try {
            ModelState state = objectMapper.readValue(json, ModelState.class);
            if (state == null) {
                throw new ModelPersistenceException("Model artifact is empty");
            }
            return state;
        } catch (JsonProcessingException e) {
            throw new ModelPersistenceException("Malformed model artifact: " + e.getOriginalMessage(), e);
        }
    }

    void write(FittedModel fitted, Path target) {
        String json = toJson(fitted);
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            try {
                Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE,
                        StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw new ModelPersistenceException("Failed to write model to " + target, e);
        }
    }

    ModelState readState(Path source) {
        try {
            return readState(Files.readString(source, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            throw new ModelPersistenceException("Model file not found: " + source, e);
        } catch (IOException e) {
            throw new ModelPersistenceException("Failed to read model from " + source, e);
        }
    }

    FittedModel toModel(ModelState state) {
        return mapper.toModel(state);
    }
}

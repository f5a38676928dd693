package com.chicu.ecorisk.ai.persistence;

import com.chicu.ecorisk.ai.ml.model.CollapseModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Модель + скейлер сериализуются одним файлом: пишем во временный файл
 * рядом и переносим поверх старого атомарным move.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileModelStore implements ModelStore {

    private final MlStorageProperties props;

    @Override
    public void save(CollapseModel model) {
        Path target = modelPath();
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");

            try (OutputStream os = Files.newOutputStream(tmp);
                 ObjectOutputStream out = new ObjectOutputStream(os)) {
                out.writeObject(model);
            }

            move(tmp, target);
            log.info("💾 Collapse model saved: {} (trainedAt={})", target, model.trainedAt());

        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("model save failed: " + target + " -> " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<CollapseModel> load() {
        Path path = modelPath();
        if (!Files.isRegularFile(path)) {
            log.info("ℹ️ No pre-trained collapse model at {}", path);
            return Optional.empty();
        }

        try (InputStream is = Files.newInputStream(path);
             ObjectInputStream in = new ObjectInputStream(is)) {
            Object o = in.readObject();
            if (!(o instanceof CollapseModel model)) {
                log.warn("⚠️ {} не содержит CollapseModel ({}), игнорируем", path, o == null ? "null" : o.getClass().getName());
                return Optional.empty();
            }
            log.info("✅ Collapse model loaded: {} (trainedAt={})", path, model.trainedAt());
            return Optional.of(model);

        } catch (IOException | ClassNotFoundException | RuntimeException e) {
            log.error("❌ Error loading collapse model from {}: {}", path, e.toString());
            return Optional.empty();
        }
    }

    Path modelPath() {
        return Paths.get(props.getModelsDir()).toAbsolutePath().resolve(props.getCollapseModelFile());
    }

    private static void move(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("⚠️ tmp file not removed: {} -> {}", p, e.getMessage());
        }
    }
}

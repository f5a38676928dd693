package com.chicu.ecorisk.ai.ml;

import com.chicu.ecorisk.ai.ml.model.CollapseModel;
import com.chicu.ecorisk.ai.persistence.ModelStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Резидентная collapse-модель + handle хранилища.
 * Пара (лес, скейлер) меняется только целиком через swap ссылки;
 * запись (обучение/загрузка) сериализуется lock'ом, чтения идут без блокировок.
 */
@Slf4j
@Component
public class CollapseModelContext {

    public static final String COLLAPSE = "collapse";

    private final ModelStore store;
    private final AtomicReference<CollapseModel> resident = new AtomicReference<>();
    private final ReentrantLock writeLock = new ReentrantLock();

    public CollapseModelContext(ModelStore store) {
        this.store = store;
    }

    public Optional<CollapseModel> current() {
        return Optional.ofNullable(resident.get());
    }

    public List<String> modelsLoaded() {
        return resident.get() != null ? List.of(COLLAPSE) : List.of();
    }

    /**
     * Обучение под lock'ом: сначала durable save, потом swap.
     * Если trainer или save упали — резидентная модель остаётся прежней.
     */
    public <R> R retrain(Supplier<Trained<R>> trainer) {
        writeLock.lock();
        try {
            Trained<R> trained = trainer.get();
            store.save(trained.model());
            CollapseModel previous = resident.getAndSet(trained.model());
            log.info("🧠 Collapse model installed (replaced={})", previous != null);
            return trained.report();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Подтянуть модель из хранилища (старт приложения).
     */
    public boolean reloadFromStore() {
        writeLock.lock();
        try {
            Optional<CollapseModel> loaded = store.load();
            loaded.ifPresent(resident::set);
            return loaded.isPresent();
        } finally {
            writeLock.unlock();
        }
    }

    public record Trained<R>(CollapseModel model, R report) {}
}

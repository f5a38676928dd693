package com.chicu.ecorisk.ai.ml;

import com.chicu.ecorisk.ai.persistence.MlStorageProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * При старте подтягиваем сохранённую collapse-модель.
 * Нет модели или она битая — работаем на эвристике, приложение не валим.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelBootstrap implements ApplicationRunner {

    private final CollapseModelContext context;
    private final MlStorageProperties props;

    @Override
    public void run(ApplicationArguments args) {
        if (!props.isLoadOnStartup()) {
            log.info("ℹ️ ml.storage.load-on-startup=false, collapse model not loaded");
            return;
        }
        try {
            boolean loaded = context.reloadFromStore();
            log.info(loaded
                    ? "✅ Collapse prediction model loaded successfully"
                    : "ℹ️ No pre-trained models found, heuristic risk estimation active");
        } catch (Exception e) {
            log.warn("⚠️ Collapse model NOT loaded: {}", e.getMessage());
        }
    }
}

package com.chicu.ecorisk.ai.persistence;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ml.storage")
public class MlStorageProperties {

    private String modelsDir = "./ml-models";

    /** Имя файла артефакта collapse-модели */
    private String collapseModelFile = "collapse_model.bin";

    /** Загрузить сохранённую модель при старте */
    private boolean loadOnStartup = true;
}

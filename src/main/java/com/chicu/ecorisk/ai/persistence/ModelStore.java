package com.chicu.ecorisk.ai.persistence;

import com.chicu.ecorisk.ai.ml.model.CollapseModel;

import java.util.Optional;

/**
 * Долговременное хранение пары (классификатор, скейлер) одним артефактом.
 */
public interface ModelStore {

    /**
     * Перезаписывает прежний артефакт целиком.
     */
    void save(CollapseModel model);

    /**
     * @return пара или empty, если артефакта нет (или он нечитаем). Частично записанная пара не возвращается никогда.
     */
    Optional<CollapseModel> load();
}

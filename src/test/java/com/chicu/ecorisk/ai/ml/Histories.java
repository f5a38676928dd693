package com.chicu.ecorisk.ai.ml;

import com.chicu.ecorisk.domain.PopulationSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Синтетические истории симуляции для тестов.
 */
public final class Histories {

    private Histories() {
    }

    /**
     * Каждый третий шаг — коллапс (травоядные вымерли), остальные — здоровая экосистема.
     * Оба класса гарантированно попадают в любой split.
     */
    public static List<PopulationSnapshot> mixed(int n) {
        List<PopulationSnapshot> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            if (i % 3 == 2) {
                out.add(PopulationSnapshot.of(i, 3 + (i % 2), 0, 4));
            } else {
                out.add(PopulationSnapshot.of(i, 60 + (i % 7) * 3, 14 + (i % 5), 5 + (i % 3)));
            }
        }
        return out;
    }

    public static List<PopulationSnapshot> flat(int n, double plants, double herbivores, double carnivores) {
        List<PopulationSnapshot> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(PopulationSnapshot.of(i, plants, herbivores, carnivores));
        }
        return out;
    }
}

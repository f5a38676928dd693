package com.chicu.ecorisk.ai.ml.features;

import com.chicu.ecorisk.common.error.InsufficientDataException;
import com.chicu.ecorisk.domain.PopulationSnapshot;
import com.chicu.ecorisk.domain.Species;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 19 фич по окну из 5 снапшотов:
 * - текущие популяции (3)
 * - средняя скорость изменения (last - first) / 5 (3)
 * - отношения plants/herb, herb/carn, carn/herb, знаменатель не меньше 1 (3)
 * - суммарная биомасса (1)
 * - std по окну, ddof=0 (3)
 * - min/max по каждому виду (6)
 *
 * Порядок и асимметрия отношений зашиты в обученную модель — не менять.
 */
@Component
public class PopulationWindowFeatureExtractor implements FeatureExtractor {

    public static final int WINDOW = 5;

    private final FeatureSchema schema = new FeatureSchema(List.of(
            "plants",
            "herbivores",
            "carnivores",
            "plant_trend",
            "herbivore_trend",
            "carnivore_trend",
            "plant_herb_ratio",
            "herb_carn_ratio",
            "carn_herb_ratio",
            "total_biomass",
            "plant_volatility",
            "herbivore_volatility",
            "carnivore_volatility",
            "min_plants",
            "max_plants",
            "min_herbivores",
            "max_herbivores",
            "min_carnivores",
            "max_carnivores"
    ));

    @Override
    public FeatureSchema schema() {
        return schema;
    }

    @Override
    public int window() {
        return WINDOW;
    }

    @Override
    public double[] extract(List<PopulationSnapshot> window) {
        if (window == null || window.size() < WINDOW) {
            throw new InsufficientDataException("Need at least " + WINDOW + " data points for a feature window, got "
                    + (window == null ? 0 : window.size()));
        }
        if (window.size() != WINDOW) {
            throw new IllegalArgumentException("feature window must contain exactly " + WINDOW
                    + " snapshots, got " + window.size());
        }

        PopulationSnapshot first = window.get(0);
        PopulationSnapshot last = window.get(WINDOW - 1);

        double[] plants = series(window, Species.PLANTS);
        double[] herbivores = series(window, Species.HERBIVORES);
        double[] carnivores = series(window, Species.CARNIVORES);

        return new double[]{
                last.plants(),
                last.herbivores(),
                last.carnivores(),

                (last.plants() - first.plants()) / WINDOW,
                (last.herbivores() - first.herbivores()) / WINDOW,
                (last.carnivores() - first.carnivores()) / WINDOW,

                last.plants() / Math.max(last.herbivores(), 1),
                last.herbivores() / Math.max(last.carnivores(), 1),
                last.carnivores() / Math.max(last.herbivores(), 1),

                last.plants() + last.herbivores() + last.carnivores(),

                Math.sqrt(StatUtils.populationVariance(plants)),
                Math.sqrt(StatUtils.populationVariance(herbivores)),
                Math.sqrt(StatUtils.populationVariance(carnivores)),

                StatUtils.min(plants),
                StatUtils.max(plants),
                StatUtils.min(herbivores),
                StatUtils.max(herbivores),
                StatUtils.min(carnivores),
                StatUtils.max(carnivores)
        };
    }

    private static double[] series(List<PopulationSnapshot> window, Species species) {
        double[] v = new double[window.size()];
        for (int i = 0; i < v.length; i++) {
            v[i] = window.get(i).value(species);
        }
        return v;
    }
}

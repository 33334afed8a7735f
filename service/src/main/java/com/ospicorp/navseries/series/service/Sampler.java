package com.ospicorp.navseries.series.service;

import com.ospicorp.navseries.series.InvalidConfigurationException;
import com.ospicorp.navseries.series.model.Observation;
import com.ospicorp.navseries.series.model.ObservationSeries;
import com.ospicorp.navseries.series.model.SamplingConfig;
import com.ospicorp.navseries.series.model.SamplingStrategy;
import java.util.ArrayList;
import java.util.List;

public final class Sampler {
  private Sampler() {
  }

  public static ObservationSeries sample(ObservationSeries in, SamplingConfig config) {
    if (config == null) {
      throw InvalidConfigurationException.missingStrategy();
    }
    return sample(in, config.strategy(), config.maxPoints());
  }

  public static ObservationSeries sample(ObservationSeries in, SamplingStrategy strategy,
      int maxPoints) {
    if (strategy == null) {
      throw InvalidConfigurationException.missingStrategy();
    }
    if (maxPoints <= 0) {
      throw InvalidConfigurationException.nonPositiveMaxPoints(maxPoints);
    }
    if (in.size() <= maxPoints) return in;
    return switch (strategy) {
      case UNIFORM -> uniform(in, maxPoints);
      case RECENT -> recent(in, maxPoints);
      case SMART -> smart(in, maxPoints);
    };
  }

  // Spaced by index, not date; the last observation is kept only if it lands on the stride
  static ObservationSeries uniform(ObservationSeries in, int maxPoints) {
    int n = in.size();
    int step = Math.max(1, (n + maxPoints - 1) / maxPoints);
    List<Observation> out = new ArrayList<>(n / step + 1);
    for (int i = 0; i < n; i += step) {
      out.add(in.get(i));
    }
    return ObservationSeries.ofOrdered(out);
  }

  static ObservationSeries recent(ObservationSeries in, int maxPoints) {
    return in.tail(in.size() - maxPoints);
  }

  // Endpoints plus each interior window's high and low; may overshoot maxPoints
  static ObservationSeries smart(ObservationSeries in, int maxPoints) {
    int n = in.size();
    if (n <= 2) return in;
    int windowSize = Math.max(3, (int) Math.floor(n / (maxPoints / 2.0)));
    int lastIndex = n - 1;

    List<Observation> out = new ArrayList<>();
    out.add(in.first());
    for (int start = 1; start < lastIndex; start += windowSize) {
      int end = Math.min(start + windowSize, lastIndex);
      int maxIdx = start;
      int minIdx = start;
      for (int i = start + 1; i < end; i++) {
        double value = in.get(i).value();
        if (value > in.get(maxIdx).value()) {
          maxIdx = i;
        }
        if (value < in.get(minIdx).value()) {
          minIdx = i;
        }
      }
      out.add(in.get(Math.min(maxIdx, minIdx)));
      if (maxIdx != minIdx) {
        out.add(in.get(Math.max(maxIdx, minIdx)));
      }
    }
    out.add(in.last());
    return ObservationSeries.sorted(out);
  }
}

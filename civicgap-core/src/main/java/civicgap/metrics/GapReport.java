package civicgap.metrics;

import civicgap.model.GapAxis;
import civicgap.model.GapMetric;

import java.util.ArrayList;
import java.util.List;

/**
 * Gap metrics for all three axes, each list in its presentation order.
 */
public record GapReport(List<GapMetric> byTheme, List<GapMetric> byGroup, List<GapMetric> byCity) {

  public static final GapReport EMPTY = new GapReport(List.of(), List.of(), List.of());

  public GapReport {
    byTheme = List.copyOf(byTheme);
    byGroup = List.copyOf(byGroup);
    byCity = List.copyOf(byCity);
  }

  public List<GapMetric> forAxis(GapAxis axis) {
    return switch (axis) {
      case THEME -> byTheme;
      case GROUP -> byGroup;
      case CITY -> byCity;
    };
  }

  /** Theme, group and city metrics concatenated. */
  public List<GapMetric> all() {
    List<GapMetric> all = new ArrayList<>(byTheme.size() + byGroup.size() + byCity.size());
    all.addAll(byTheme);
    all.addAll(byGroup);
    all.addAll(byCity);
    return List.copyOf(all);
  }
}

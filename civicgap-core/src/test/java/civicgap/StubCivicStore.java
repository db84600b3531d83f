package civicgap;

import civicgap.model.Citizen;
import civicgap.model.DailyCount;
import civicgap.model.GapAxis;
import civicgap.model.GapMetric;
import civicgap.model.Interaction;
import civicgap.model.Proposal;
import civicgap.spi.CivicStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory CivicStore for unit tests that don't need real JDBC. Citizens must be
 * referenced by id; queued failures are thrown by the next inserts.
 */
public class StubCivicStore implements CivicStore {
  public final List<Citizen> citizens = new ArrayList<>();
  public final List<Interaction> interactions = new ArrayList<>();
  public final List<Proposal> proposals = new ArrayList<>();
  public final Map<GapAxis, Map<String, Long>> demand = new TreeMap<>();
  public final Map<GapAxis, Map<String, Long>> bills = new TreeMap<>();
  public List<GapMetric> cachedMetrics = List.of();
  public final AtomicInteger insertCalls = new AtomicInteger();
  /** Window starts passed to {@link #dailyInteractionCounts}. */
  public final List<Instant> trendQueries = new ArrayList<>();

  private final Deque<RuntimeException> insertFailures = new ArrayDeque<>();

  public Citizen addCitizen(String token, String city) {
    Citizen citizen = new Citizen(citizens.size() + 1, token, city, null, Set.of(), Instant.EPOCH);
    citizens.add(citizen);
    return citizen;
  }

  /** The next insert throws {@code failure}. */
  public void failNextInsert(RuntimeException failure) {
    insertFailures.add(failure);
  }

  private void maybeFail() {
    insertCalls.incrementAndGet();
    RuntimeException failure = insertFailures.poll();
    if (failure != null) {
      throw failure;
    }
  }

  @Override
  public Optional<Citizen> findCitizenById(Connection conn, long id) {
    return citizens.stream().filter(c -> c.id() == id).findFirst();
  }

  @Override
  public Optional<Citizen> findCitizenByToken(Connection conn, String identityToken) {
    return citizens.stream().filter(c -> c.identityToken().equals(identityToken)).findFirst();
  }

  @Override
  public Citizen insertCitizen(Connection conn, String identityToken, String city,
      String inclusionGroup, Set<String> interestThemes) {
    maybeFail();
    Citizen citizen = new Citizen(citizens.size() + 1, identityToken, city, inclusionGroup,
        interestThemes, Instant.EPOCH);
    citizens.add(citizen);
    return citizen;
  }

  @Override
  public long countCitizens(Connection conn) {
    return citizens.size();
  }

  @Override
  public Interaction insertInteraction(Connection conn, Interaction row) {
    maybeFail();
    Interaction saved = new Interaction(interactions.size() + 1, row.citizenId(), row.billId(), row.kind(),
        row.opinion(), row.content(), row.metadata(), row.occurredAt(), Instant.EPOCH);
    interactions.add(saved);
    return saved;
  }

  @Override
  public Optional<Interaction> findInteraction(Connection conn, long id) {
    return interactions.stream().filter(i -> i.id() == id).findFirst();
  }

  @Override
  public long countInteractions(Connection conn) {
    return interactions.size();
  }

  @Override
  public long countInteractionsSince(Connection conn, Instant since) {
    return interactions.stream().filter(i -> !i.occurredAt().isBefore(since)).count();
  }

  @Override
  public List<DailyCount> dailyInteractionCounts(Connection conn, Instant since) {
    trendQueries.add(since);
    Map<LocalDate, Long> perDay = new TreeMap<>();
    for (Interaction interaction : interactions) {
      if (!interaction.occurredAt().isBefore(since)) {
        perDay.merge(LocalDate.ofInstant(interaction.occurredAt(), ZoneOffset.UTC), 1L, Long::sum);
      }
    }
    return perDay.entrySet().stream().map(e -> new DailyCount(e.getKey(), e.getValue())).toList();
  }

  @Override
  public Proposal insertProposal(Connection conn, Proposal row) {
    maybeFail();
    Proposal saved = new Proposal(proposals.size() + 1, row.citizenId(), row.content(), row.contentKind(),
        row.audioUrl(), row.primaryTheme(), row.secondaryThemes(), row.confidence(), row.city(),
        row.inclusionGroup(), row.status(), row.duplicateGroupId(), row.occurredAt(), Instant.EPOCH);
    proposals.add(saved);
    return saved;
  }

  @Override
  public Optional<Proposal> findProposal(Connection conn, long id) {
    return proposals.stream().filter(p -> p.id() == id).findFirst();
  }

  @Override
  public long countProposals(Connection conn) {
    return proposals.size();
  }

  @Override
  public List<Proposal> recentProposals(Connection conn, int limit) {
    return proposals.stream()
        .sorted(Comparator.comparingLong(Proposal::id).reversed())
        .limit(limit)
        .toList();
  }

  @Override
  public Map<String, Long> countDemand(Connection conn, GapAxis axis) {
    return demand.getOrDefault(axis, Map.of());
  }

  @Override
  public Map<String, Long> countActiveBills(Connection conn, GapAxis axis) {
    if (axis == GapAxis.GROUP) {
      throw new IllegalArgumentException("Bills are not segmented by inclusion group");
    }
    return bills.getOrDefault(axis, Map.of());
  }

  @Override
  public void replaceGapMetrics(Connection conn, List<GapMetric> metrics) {
    maybeFail();
    cachedMetrics = List.copyOf(metrics);
  }

  @Override
  public List<GapMetric> findGapMetrics(Connection conn) {
    return cachedMetrics;
  }
}

package rvfchecks.checks;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Checks keyed by name. A check whose name is already present replaces the earlier one but keeps its position.
 */
public class CheckSet implements Iterable<Check> {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final LinkedHashMap<String, Check> checks = new LinkedHashMap<>();

  public void add(Check check) {
    if (checks.put(check.name, check) != null)
      logger.debug("Check {} was generated more than once, keeping one", check.name);
  }

  public void addAll(CheckSet other) { other.forEach(this::add); }

  public Optional<Check> get(String name) { return Optional.ofNullable(checks.get(name)); }

  public int size() { return checks.size(); }

  public Collection<Check> checks() { return Collections.unmodifiableCollection(checks.values()); }

  @Override
  public Iterator<Check> iterator() {
    return checks().iterator();
  }
}

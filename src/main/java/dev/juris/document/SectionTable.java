package dev.juris.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Id-keyed view over the flat section list of a document.
 *
 * <p>Parent and child relations are resolved by id lookups; dangling ids (a parent or child that
 * the parser did not deliver) resolve to nothing rather than failing. Cycles in parent ids are cut
 * when walking ancestors.
 */
public final class SectionTable {

  private final Map<String, Section> byId;

  public SectionTable(List<Section> sections) {
    Map<String, Section> table = new LinkedHashMap<>();
    for (Section section : sections) {
      table.putIfAbsent(section.id(), section);
    }
    this.byId = Collections.unmodifiableMap(table);
  }

  public Optional<Section> get(String id) {
    return Optional.ofNullable(byId.get(id));
  }

  public Optional<Section> parent(Section section) {
    return section.parentId() == null ? Optional.empty() : get(section.parentId());
  }

  public List<Section> children(Section section) {
    List<Section> children = new ArrayList<>();
    for (String childId : section.childIds()) {
      get(childId).ifPresent(children::add);
    }
    return children;
  }

  /**
   * Returns the ancestors of a section from the root down to its direct parent.
   *
   * @param section the section whose ancestry is resolved
   * @return ancestors ordered root first; empty for top-level sections
   */
  public List<Section> ancestors(Section section) {
    List<Section> chain = new ArrayList<>();
    Optional<Section> current = parent(section);
    while (current.isPresent() && !chain.contains(current.get()) && current.get() != section) {
      chain.add(current.get());
      current = parent(current.get());
    }
    Collections.reverse(chain);
    return chain;
  }

  public int size() {
    return byId.size();
  }
}

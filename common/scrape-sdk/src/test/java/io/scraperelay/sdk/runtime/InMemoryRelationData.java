package io.scraperelay.sdk.runtime;

import io.scraperelay.sdk.ports.RelationDataPort;
import io.scraperelay.sdk.ports.RelationMetadata;
import io.scraperelay.sdk.ports.RelationView;
import io.scraperelay.topology.RelationRole;
import io.scraperelay.topology.TopologyDefaults;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relation data held in maps, standing in for the agent that normally stores it.
 */
final class InMemoryRelationData implements RelationDataPort {

  private final Map<String, RelationMetadata> declarations = new HashMap<>();
  private final Map<String, List<FakeRelation>> established = new LinkedHashMap<>();
  private int nextId = 1;

  InMemoryRelationData declare(String name, RelationRole role) {
    return declare(name, TopologyDefaults.RELATION_INTERFACE, role);
  }

  InMemoryRelationData declare(String name, String interfaceName, RelationRole role) {
    declarations.put(name, new RelationMetadata(name, interfaceName, role));
    return this;
  }

  FakeRelation relate(String name, String remoteApplication) {
    FakeRelation relation = new FakeRelation(nextId++, name, remoteApplication);
    established.computeIfAbsent(name, key -> new ArrayList<>()).add(relation);
    return relation;
  }

  @Override
  public List<RelationView> relations(String relationName) {
    return List.copyOf(established.getOrDefault(relationName, List.of()));
  }

  @Override
  public Optional<RelationMetadata> metadata(String relationName) {
    return Optional.ofNullable(declarations.get(relationName));
  }

  static final class FakeRelation implements RelationView {

    private final int id;
    private final String name;
    private final String remoteApplication;
    private final Map<String, String> remoteApplicationData = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> remoteUnitData = new LinkedHashMap<>();
    private final Map<String, String> localApplicationData = new LinkedHashMap<>();
    private final Map<String, String> localUnitData = new LinkedHashMap<>();
    private int localApplicationWrites;

    FakeRelation(int id, String name, String remoteApplication) {
      this.id = id;
      this.name = name;
      this.remoteApplication = remoteApplication;
    }

    FakeRelation remoteApp(String key, String value) {
      remoteApplicationData.put(key, value);
      return this;
    }

    FakeRelation unit(String unit, String... keyValues) {
      Map<String, String> data = remoteUnitData.computeIfAbsent(unit, key -> new LinkedHashMap<>());
      for (int i = 0; i + 1 < keyValues.length; i += 2) {
        data.put(keyValues[i], keyValues[i + 1]);
      }
      return this;
    }

    FakeRelation removeUnit(String unit) {
      remoteUnitData.remove(unit);
      return this;
    }

    Map<String, String> localApplicationData() {
      return localApplicationData;
    }

    Map<String, String> localUnitData() {
      return localUnitData;
    }

    int localApplicationWrites() {
      return localApplicationWrites;
    }

    @Override
    public int id() {
      return id;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public Optional<String> remoteApplication() {
      return Optional.ofNullable(remoteApplication);
    }

    @Override
    public List<String> remoteUnits() {
      return List.copyOf(remoteUnitData.keySet());
    }

    @Override
    public Optional<String> remoteApplicationValue(String key) {
      return Optional.ofNullable(remoteApplicationData.get(key));
    }

    @Override
    public Optional<String> remoteUnitValue(String unit, String key) {
      return Optional.ofNullable(remoteUnitData.getOrDefault(unit, Map.of()).get(key));
    }

    @Override
    public Optional<String> localApplicationValue(String key) {
      return Optional.ofNullable(localApplicationData.get(key));
    }

    @Override
    public void setLocalApplicationValue(String key, String value) {
      localApplicationWrites++;
      localApplicationData.put(key, value);
    }

    @Override
    public void setLocalUnitValue(String key, String value) {
      localUnitData.put(key, value);
    }
  }
}

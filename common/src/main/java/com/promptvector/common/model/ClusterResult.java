package com.promptvector.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One cluster of the vector space: its centroid, members and aggregate stats.
 * Cached results are shared, so the centroid is copied on the way in and out.
 */
@Builder
public record ClusterResult(
    @JsonProperty("id")
    String id,

    @JsonProperty("name")
    String name,

    @JsonProperty("centroid")
    float[] centroid,

    @JsonProperty("members")
    List<ClusterMember> members,

    @JsonProperty("stats")
    ClusterStats stats
) {
    public ClusterResult {
        members = members == null ? List.of() : List.copyOf(members);
        centroid = centroid == null ? null : centroid.clone();
    }

    @Override
    @JsonProperty("centroid")
    public float[] centroid() {
        return centroid == null ? null : centroid.clone();
    }

    public int size() {
        return members.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClusterResult)) {
            return false;
        }
        ClusterResult other = (ClusterResult) o;
        return Objects.equals(id, other.id)
            && Objects.equals(name, other.name)
            && Arrays.equals(centroid, other.centroid)
            && members.equals(other.members)
            && Objects.equals(stats, other.stats);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, Arrays.hashCode(centroid), members, stats);
    }

    @Override
    public String toString() {
        return "ClusterResult[id=" + id + ", name=" + name + ", centroid=" + Arrays.toString(centroid)
            + ", members=" + members + ", stats=" + stats + "]";
    }
}

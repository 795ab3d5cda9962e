package com.recordcache.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Objects;

/**
 * Entity record. Immutable, so a reference handed out by the cache stays
 * consistent after eviction or replacement.
 */
public final class Record {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final long id;
    private final String name;
    private final String email;

    @JsonCreator
    public Record(
            @JsonProperty("id") long id,
            @JsonProperty("name") String name,
            @JsonProperty("email") String email) {
        this.id = id;
        this.name = name;
        this.email = email;
    }

    @JsonProperty("id")
    public long getId() { return id; }

    @JsonProperty("name")
    public String getName() { return name; }

    @JsonProperty("email")
    public String getEmail() { return email; }

    public Record withName(String newName) {
        return new Record(id, newName, email);
    }

    public Record withEmail(String newEmail) {
        return new Record(id, name, newEmail);
    }

    public byte[] serialize() {
        try {
            return objectMapper.writeValueAsBytes(this);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize record " + id, e);
        }
    }

    public static Record deserialize(byte[] data) throws IOException {
        return objectMapper.readValue(data, Record.class);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record)) return false;
        Record other = (Record) o;
        return id == other.id && Objects.equals(name, other.name) && Objects.equals(email, other.email);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, email);
    }

    @Override
    public String toString() {
        return "Record{id=" + id + ", name='" + name + "', email='" + email + "'}";
    }
}

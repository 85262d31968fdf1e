package com.umitunal.tasklite.worker;

import java.util.Objects;

/**
 * Typed job kind. The name is persisted with each job and selects its
 * handler; the payload class is used to decode the stored payload.
 *
 * @param <P> the payload type
 */
public final class JobType<P> {
    private final String name;
    private final Class<P> payloadType;

    private JobType(String name, Class<P> payloadType) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        this.name = name;
        this.payloadType = Objects.requireNonNull(payloadType, "payloadType must not be null");
    }

    public static <P> JobType<P> of(String name, Class<P> payloadType) {
        return new JobType<>(name, payloadType);
    }

    public String name() {
        return name;
    }

    public Class<P> payloadType() {
        return payloadType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobType)) return false;
        JobType<?> other = (JobType<?>) o;
        return name.equals(other.name) && payloadType.equals(other.payloadType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, payloadType);
    }

    @Override
    public String toString() {
        return "JobType{" + name + ", " + payloadType.getSimpleName() + "}";
    }
}

package com.moldstudio.reservation.domain.model;

/**
 * One status axis of a reservation. Each axis advances through its own fixed cycle;
 * {@link #next()} is a pure function of the current value.
 */
public interface CyclicStatus<S extends Enum<S> & CyclicStatus<S>> {

    S next();
}

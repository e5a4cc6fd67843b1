package com.tessera.eventstore;

import com.tessera.eventmodel.DomainEvent;

/** Event fixture carrying nothing but a marker string. */
public record Marked(String originatorId, long originatorVersion, String marker) implements DomainEvent {}

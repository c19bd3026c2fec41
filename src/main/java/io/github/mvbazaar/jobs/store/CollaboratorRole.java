package io.github.mvbazaar.jobs.store;

public enum CollaboratorRole {CREATOR, CONTRIBUTOR, ADVISOR}

package com.metbull.sync.reconcile.model;

public record ApplyResult(int examined, int filled, int remaining) {
}

package com.metbull.sync.reconcile.model;

public enum FetchFailure {
    TIMEOUT,
    HTTP_ERROR,
    NETWORK_ERROR
}

package com.myorg.saga.eventing.runtime;

public interface UnitOfWorkFactory {
    UnitOfWork begin(String name);
}

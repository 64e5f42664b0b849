package com.autonomous.treasury.store;

import lombok.Value;

/**
 * A cached value together with the version token it was read at. Version {@code 0} means
 * the key did not exist.
 */
@Value
public class Versioned<T> {
    T value;
    long version;
}

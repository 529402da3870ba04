package com.cajunsystems.aeiou.task;

/**
 * Descriptor of a sub-task requested by a root computation. The identity orders the task table.
 */
public interface Task<K extends Comparable<? super K>> {
    K id();
}

package com.demo.loanmodel.ranges;

/** Bounds and slider step the client uses to validate a field; min and max are truncated to integers. */
public record InputRange(long min, long max, long step) {
}

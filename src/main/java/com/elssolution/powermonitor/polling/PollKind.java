package com.elssolution.powermonitor.polling;

/** The two independently supervised loop populations. */
public enum PollKind { READING, ENERGY }

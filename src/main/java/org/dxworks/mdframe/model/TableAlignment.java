package org.dxworks.mdframe.model;

public enum TableAlignment {
    NONE,
    LEFT,
    CENTER,
    RIGHT
}

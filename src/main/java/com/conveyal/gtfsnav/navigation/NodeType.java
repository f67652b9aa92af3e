package com.conveyal.gtfsnav.navigation;

/** What a navigation node was selected by. */
public enum NodeType {
    ROOT,
    ROUTE,
    STOP
}

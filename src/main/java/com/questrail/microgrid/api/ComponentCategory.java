package com.questrail.microgrid.api;

/**
 * Category of an electrical component. The category selects the action plans
 * executed for lifecycle transitions.
 */
public enum ComponentCategory
{
    INVERTER,
    BATTERY,
    RELAY,
    PRECHARGE_MODULE,
    OTHER
}

package com.syro.core.cooldown;

public enum CooldownScope {
    USER,
    GLOBAL
}

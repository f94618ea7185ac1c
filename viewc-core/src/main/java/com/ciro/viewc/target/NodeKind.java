package com.ciro.viewc.target;

public enum NodeKind { ELEMENT, TEXT }

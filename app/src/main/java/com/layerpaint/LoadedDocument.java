package com.layerpaint;

/**
 * A freshly decoded canvas together with the tool settings saved alongside it.
 */
public record LoadedDocument(LayeredCanvas canvas, ToolState toolState) {}

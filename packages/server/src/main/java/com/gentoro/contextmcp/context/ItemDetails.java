package com.gentoro.contextmcp.context;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import java.util.List;

/** An item and, when requested, its version history newest-first ({@code null} otherwise). */
public record ItemDetails(@JsonUnwrapped ContextItem item, List<ItemVersion> versions) {}

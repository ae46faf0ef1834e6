package com.williamcallahan.competencysearch.web;

import java.util.List;

/**
 * Identifiers created by an import.
 *
 * @param identifiers UUID strings in import order
 */
public record ImportResponse(List<String> identifiers) {}

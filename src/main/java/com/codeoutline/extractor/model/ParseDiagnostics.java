package com.codeoutline.extractor.model;

import java.util.ArrayList;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Diagnostics (errors/warnings/info) accumulated during one parse.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
@EqualsAndHashCode
public class ParseDiagnostics {
  private final List<String> errors = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();
  private final List<String> infos = new ArrayList<>();

  public boolean hasErrors() {
	  return !this.errors.isEmpty();
  }

  public boolean hasWarnings() {
	  return !this.warnings.isEmpty();
  }

}

package com.designcontext.simplifier.cli.exception;

import java.util.List;

/**
 * Every problem found in the command-line options of one invocation.
 */
public class OptionsValidationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final List<String> errors;

	public OptionsValidationException(List<String> errors) {
		super(summary(errors));
		this.errors = List.copyOf(errors);
	}

	public List<String> getErrors() {
		return errors;
	}

	public int getErrorCount() {
		return errors.size();
	}

	private static String summary(List<String> errors) {
		if (errors.size() == 1) {
			return errors.get(0);
		}
		return errors.size() + " invalid options: " + String.join("; ", errors);
	}
}

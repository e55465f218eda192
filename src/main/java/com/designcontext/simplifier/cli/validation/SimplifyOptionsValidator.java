package com.designcontext.simplifier.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.designcontext.simplifier.cli.exception.OptionsValidationException;
import com.designcontext.simplifier.cli.model.SimplifyOptions;
import com.designcontext.simplifier.cli.model.ValidatedSimplifyOptions;
import com.designcontext.simplifier.resolver.ResolverConfig;

public class SimplifyOptionsValidator {

	public ValidatedSimplifyOptions validate(SimplifyOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getInput() == null) {
			errors.add("Design document is required (--input / -i).");
		} else if (!existsFile(o.getInput())) {
			errors.add("Design document does not exist or is not a file: " + o.getInput());
		}

		if (o.getVariables() != null && !existsFile(o.getVariables())) {
			errors.add("Variables document does not exist or is not a file: " + o.getVariables());
		}
		if (o.getTokens() != null && !existsFile(o.getTokens())) {
			errors.add("Design-token document does not exist or is not a file: " + o.getTokens());
		}
		if (o.getHeuristics() != null && !existsFile(o.getHeuristics())) {
			errors.add("Heuristics file does not exist or is not a file: " + o.getHeuristics());
		}
		if (o.getMappingDir() != null && !Files.isDirectory(o.getMappingDir())) {
			errors.add("Mapping directory does not exist or is not a directory: " + o.getMappingDir());
		}

		if (o.getMaxDepth() != null && o.getMaxDepth() < 0) {
			errors.add("Max depth must be >= 0. Got: " + o.getMaxDepth());
		}

		if (!isBlank(o.getMappingUrl()) && !o.getMappingUrl().startsWith("http://")
				&& !o.getMappingUrl().startsWith("https://")) {
			errors.add("Mapping URL must be an http or https URL. Got: " + o.getMappingUrl());
		}

		Path outputFile = null;
		if (o.getOutput() != null) {
			outputFile = o.getOutput().toAbsolutePath().normalize();
			if (Files.isDirectory(outputFile)) {
				errors.add("Output path is a directory: " + outputFile);
			} else if (Files.exists(outputFile) && !o.isForce()) {
				errors.add("Output file already exists: " + outputFile + ". Use --force to overwrite.");
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		List<Path> searchDirectories = new ArrayList<>();
		if (o.getMappingDir() != null) {
			searchDirectories.add(o.getMappingDir().toAbsolutePath().normalize());
		}
		for (Path directory : ResolverConfig.defaultSearchDirectories()) {
			if (!searchDirectories.contains(directory)) {
				searchDirectories.add(directory);
			}
		}

		return new ValidatedSimplifyOptions(o.getInput().toAbsolutePath().normalize(), outputFile,
				List.copyOf(searchDirectories));
	}

	private static boolean existsFile(Path p) {
		return p != null && Files.isRegularFile(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}

package com.designcontext.simplifier.cli.model;

import java.nio.file.Path;

import com.designcontext.simplifier.walker.extractor.ExtractorPreset;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "simplify" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class SimplifyOptions {

	@Option(names = { "--input", "-i" }, description = "Design document fetched from the platform (file or nodes response)")
	private Path input;

	@Option(names = { "--variables" }, description = "Variables response for the same file, if it was fetched")
	private Path variables;

	@Option(names = {
			"--file-key" }, defaultValue = "${env:FIGMA_LIBRARY_FILE_KEY}", description = "Platform key of the design file, recorded in exported mappings")
	private String fileKey;

	@Option(names = { "--output", "-o" }, description = "Where to write the simplified design (defaults to standard output)")
	private Path output;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

	@Option(names = { "--max-depth", "-d" }, description = "Do not descend below this depth (roots are depth 0)")
	private Integer maxDepth;

	@Option(names = {
			"--extractors" }, defaultValue = "ALL", description = "Extractor preset: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
	private ExtractorPreset extractors;

	@Option(names = {
			"--mapping-url" }, defaultValue = "${env:FIGMA_VARIABLE_MAPPINGS_URL}", description = "Remote variable mapping endpoint")
	private String mappingUrl;

	@Option(names = {
			"--mapping-dir" }, description = "Directory to search for the mapping file before the default locations")
	private Path mappingDir;

	@Option(names = { "--tokens" }, description = "Design-token export used as the lowest priority mapping source")
	private Path tokens;

	@Option(names = { "--heuristics" }, description = "JSON file with variant-analysis heuristics")
	private Path heuristics;

	@Option(names = { "--export-mappings" }, description = "Also write the fetched variables as a mapping file")
	private Path exportMappings;

	@Option(names = { "--skip-resolution" }, description = "Leave variable and text-style references unresolved")
	private boolean skipResolution;

	@Option(names = { "--pretty" }, description = "Indent the JSON output")
	private boolean pretty;

}

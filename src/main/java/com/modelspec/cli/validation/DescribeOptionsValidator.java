package com.modelspec.cli.validation;

import java.util.ArrayList;
import java.util.List;

import com.modelspec.cli.exception.OptionsValidationException;
import com.modelspec.cli.model.DescribeOptions;
import com.modelspec.registry.ModelRegistry;
import com.modelspec.registry.Modes;
import com.modelspec.util.NamingUtil;

import lombok.RequiredArgsConstructor;

/**
 * Checks "describe" options against the registry.
 */
@RequiredArgsConstructor
public class DescribeOptionsValidator {

	private final ModelRegistry registry;

	public void validate(DescribeOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getModel() == null) {
			if (o.getEngine() != null) {
				errors.add("--engine can only be used together with --model.");
			}
		} else if (!registry.isRegistered(o.getModel())) {
			errors.add("Unknown model '" + o.getModel() + "'." + NamingUtil.didYouMean(o.getModel(), registry.modelNames()));
		} else {
			List<String> modes = registry.modes(o.getModel());
			if (o.getMode() != null && !modes.contains(o.getMode())) {
				errors.add("Model '" + o.getModel() + "' has no mode '" + o.getMode() + "'. Possible modes: " + modes);
			}
			List<String> engines = registry.engines(o.getModel(), Modes.UNKNOWN);
			if (o.getEngine() != null && !engines.contains(o.getEngine())) {
				errors.add("Model '" + o.getModel() + "' has no engine '" + o.getEngine() + "'."
						+ NamingUtil.didYouMean(o.getEngine(), engines));
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
	}
}

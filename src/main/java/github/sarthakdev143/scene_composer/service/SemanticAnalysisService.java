package github.sarthakdev143.scene_composer.service;

import github.sarthakdev143.scene_composer.model.SemanticAnalysis;

/**
 * Optional external text analysis. Implementations may block, fail or return partial results;
 * callers treat every such outcome as "no analysis".
 */
public interface SemanticAnalysisService {

    SemanticAnalysis analyze(String text);
}

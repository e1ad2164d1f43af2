package github.sarthakdev143.scene_composer.model;

public record CoverageReport(
        int totalSections,
        int fullyCovered,
        int partiallyCovered,
        int notCovered,
        double coverageRate) {
}

package tech.entragov.analyzer.review;

/**
 * @param rate decided / assigned
 */
public record ReviewerParticipation(
    String reviewerId,
    int assigned,
    int decided,
    double rate
) {}

package tuftrust.model;

/**
 * A target and the role that signs for it.
 */
public record TargetWithRole(
        Target target,
        RoleName role
) {}

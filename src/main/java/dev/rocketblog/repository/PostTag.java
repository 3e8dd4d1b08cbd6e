package dev.rocketblog.repository;

import dev.rocketblog.entity.Tag;

import java.util.UUID;

/**
 * One row of the post/tag association, with the tag already materialised.
 */
public record PostTag(UUID postId, Tag tag) {}

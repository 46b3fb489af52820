package com.taskmeister.assignment.config;

import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Assignment input rules.
 *
 * @param commentMaxLength longest accepted assignment comment
 * @param zone zone that decides which calendar day is "today" for the past-date check
 */
@ConfigurationProperties(prefix = "taskmeister.assignment")
public record AssignmentRuleProperties(
    @DefaultValue("500") int commentMaxLength, @DefaultValue("UTC") ZoneId zone) {}

package com.example.search.source.adapter.sample;

import com.example.search.source.adapter.sample.SampleSourceAdapter.SampleDocument;
import com.example.search.source.model.AccessLevel;
import com.example.search.source.model.SourceId;
import com.example.search.source.model.UpdateType;

import java.time.Duration;
import java.util.List;

/**
 * Development fixtures for each source.
 */
final class SampleDocuments {

    private SampleDocuments() {}

    static List<SampleDocument> forSource(SourceId source) {
        return switch (source) {
            case GDRIVE -> GDRIVE;
            case NOTION -> NOTION;
            case SLACK -> SLACK;
            case CONFLUENCE -> CONFLUENCE;
        };
    }

    private static final List<SampleDocument> GDRIVE = List.of(
            new SampleDocument(
                    "1BxY2zW3vU4sR5qP6oN7mL8kJ9hG",
                    "Q4 Budget Planning",
                    "Updated quarterly budget allocations and revised spending projections based on current market conditions.",
                    "Q4 budget planning. Allocations were revised for engineering, marketing and operations. "
                            + "Spending projections now assume flat revenue for the quarter.",
                    "https://docs.google.com/spreadsheets/d/1BxY2zW3vU4sR5qP6oN7mL8kJ9hG/edit",
                    "Finance Team",
                    Duration.ofHours(2),
                    AccessLevel.EDITOR,
                    UpdateType.MODIFIED),
            new SampleDocument(
                    "2CyZ3xW4vU5sR6qP7oN8mL9kJ0hG",
                    "Team Performance Review Template",
                    "Created new template for annual performance reviews with updated criteria and evaluation metrics.",
                    "Performance review template. Each review covers goals, competencies and growth areas.",
                    "https://docs.google.com/document/d/2CyZ3xW4vU5sR6qP7oN8mL9kJ0hG/edit",
                    "HR Department",
                    Duration.ofDays(1),
                    AccessLevel.VIEWER,
                    UpdateType.CREATED),
            new SampleDocument(
                    "3DzA4yX5wV6tS7rQ8pO9nM0lK1iH",
                    "Project Timeline Update",
                    "Revised project milestones and deliverable dates to accommodate new requirements and resource constraints.",
                    "# Project Proposal: Workplace Search Enhancement\n\n"
                            + "## Executive Summary\n"
                            + "This document outlines the plan for unified search across Google Drive, Notion, Slack and Confluence.\n\n"
                            + "## Implementation Timeline\n"
                            + "- Phase 1: Core server development (4 weeks)\n"
                            + "- Phase 2: Google Drive integration (2 weeks)\n"
                            + "- Phase 3: Additional source integrations (6 weeks)\n",
                    "https://docs.google.com/document/d/3DzA4yX5wV6tS7rQ8pO9nM0lK1iH/edit",
                    "Project Manager",
                    Duration.ofDays(2).plusHours(5),
                    AccessLevel.OWNER,
                    UpdateType.MODIFIED)
    );

    private static final List<SampleDocument> NOTION = List.of(
            new SampleDocument(
                    "8f1c2d3e4b5a",
                    "Engineering Onboarding Guide",
                    "Step-by-step onboarding checklist for new engineers, including access requests and first-week tasks.",
                    "Engineering onboarding guide. Request repository access on day one and pair with a buddy for the first week.",
                    "https://www.notion.so/acme/Engineering-Onboarding-Guide-8f1c2d3e4b5a",
                    "Platform Team",
                    Duration.ofHours(20),
                    AccessLevel.VIEWER,
                    UpdateType.MODIFIED),
            new SampleDocument(
                    "9a8b7c6d5e4f",
                    "Budget Review Meeting Notes",
                    "Notes from the monthly budget review covering vendor contracts and hiring plans.",
                    "Budget review notes. Vendor contracts are up for renewal in March and two hiring requests were approved.",
                    "https://www.notion.so/acme/Budget-Review-Meeting-Notes-9a8b7c6d5e4f",
                    "Operations",
                    Duration.ofDays(3),
                    AccessLevel.EDITOR,
                    UpdateType.COMMENTED)
    );

    private static final List<SampleDocument> SLACK = List.of(
            new SampleDocument(
                    "C024BE91L:1712345678.000200",
                    "#announcements",
                    "The office will be closed on Friday for the company offsite.",
                    "The office will be closed on Friday for the company offsite. Remote support rotations are unchanged.",
                    "https://acme.slack.com/archives/C024BE91L/p1712345678000200",
                    "People Ops",
                    Duration.ofHours(5),
                    AccessLevel.VIEWER,
                    UpdateType.CREATED),
            new SampleDocument(
                    "C0931QX7P:1712300000.000100",
                    "#finance",
                    "Reminder: budget submissions for next quarter are due by end of week.",
                    "Reminder: budget submissions for next quarter are due by end of week. Use the shared template.",
                    "https://acme.slack.com/archives/C0931QX7P/p1712300000000100",
                    "Finance Team",
                    Duration.ofDays(4),
                    AccessLevel.VIEWER,
                    UpdateType.SHARED)
    );

    private static final List<SampleDocument> CONFLUENCE = List.of(
            new SampleDocument(
                    "SPACE-ENG:557081",
                    "Incident Response Runbook",
                    "Procedures for triaging, escalating and resolving production incidents.",
                    "Incident response runbook. Page the on-call engineer, open an incident channel and post status updates every thirty minutes.",
                    "https://acme.atlassian.net/wiki/spaces/ENG/pages/557081",
                    "SRE Team",
                    Duration.ofDays(6),
                    AccessLevel.VIEWER,
                    UpdateType.MODIFIED),
            new SampleDocument(
                    "SPACE-FIN:604112",
                    "Annual Budget Process",
                    "How departments prepare, submit and get approval for the annual budget.",
                    "Annual budget process. Departments submit drafts in October and final numbers are approved in December.",
                    "https://acme.atlassian.net/wiki/spaces/FIN/pages/604112",
                    "Finance Team",
                    Duration.ofDays(12),
                    AccessLevel.RESTRICTED,
                    UpdateType.MODIFIED)
    );
}

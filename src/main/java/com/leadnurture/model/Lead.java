package com.leadnurture.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * A prospective client. The nurture engine reads leads and asks the store to
 * update their status; it never edits contact details.
 *
 * The boolean flags feed both scoring and campaign selection:
 *   veteran / inRecovery / reentry  → demographic points + campaign type
 *   currentlyHomeless / evictionRisk → urgency points
 */
@Entity
@Table(name = "leads")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class Lead {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String name;

    private String email;

    private String phone;

    @Builder.Default
    private String source = "website";

    private boolean veteran;

    @Column(name = "in_recovery")
    private boolean inRecovery;

    private boolean reentry;

    @Column(name = "currently_homeless")
    private boolean currentlyHomeless;

    @Column(name = "eviction_risk")
    private boolean evictionRisk;

    @Column(name = "has_family")
    private boolean hasFamily;

    @Column(name = "household_size")
    private Integer householdSize;

    @Enumerated(EnumType.STRING)
    @Column(name = "employment_status")
    @Builder.Default
    private EmploymentStatus employmentStatus = EmploymentStatus.UNKNOWN;

    @Column(name = "move_in_date")
    private LocalDate moveInDate;

    @Column(name = "income_verified")
    private boolean incomeVerified;

    @Column(name = "references_provided")
    private boolean referencesProvided;

    @Column(name = "background_check_consent")
    private boolean backgroundCheckConsent;

    @Column(name = "opted_out")
    private boolean optedOut;

    @Column(name = "email_bounced")
    private boolean emailBounced;

    @Column(name = "phone_invalid")
    private boolean phoneInvalid;

    @Column(name = "phone_contacted")
    private boolean phoneContacted;

    @Column(name = "appointment_scheduled")
    private boolean appointmentScheduled;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "lead_tags", joinColumns = @JoinColumn(name = "lead_id"))
    @Column(name = "tag")
    @Builder.Default
    private Set<String> tags = new HashSet<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private LeadStatus status = LeadStatus.NEW;

    // Free-text summary, e.g. the transcript digest of a promoted chat
    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "chat_session_id")
    private String chatSessionId;

    @Column(name = "last_contact_at")
    private Instant lastContactAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public boolean hasTag(String tag) {
        return tags != null && tags.stream().anyMatch(t -> t.equalsIgnoreCase(tag));
    }
}

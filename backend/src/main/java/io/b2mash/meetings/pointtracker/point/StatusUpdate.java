package io.b2mash.meetings.pointtracker.point;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** Append-only history entry of a point. No setters. */
@Entity
@Table(name = "status_updates")
public class StatusUpdate {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "point_id", nullable = false, updatable = false)
  private UUID pointId;

  @Column(name = "date", nullable = false, updatable = false)
  private LocalDate date;

  @Column(name = "status", nullable = false, updatable = false, length = 4000)
  private String status;

  @Column(name = "action_on", nullable = false, updatable = false)
  private String actionOn;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected StatusUpdate() {}

  public StatusUpdate(UUID pointId, LocalDate date, String status, String actionOn) {
    this.pointId = pointId;
    this.date = date;
    this.status = status;
    this.actionOn = actionOn;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getPointId() {
    return pointId;
  }

  public LocalDate getDate() {
    return date;
  }

  public String getStatus() {
    return status;
  }

  public String getActionOn() {
    return actionOn;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}

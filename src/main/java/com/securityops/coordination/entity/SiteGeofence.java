package com.securityops.coordination.entity;

import com.securityops.coordination.dto.CachedGeofenceRecord;
import com.securityops.coordination.dto.GeofenceShape;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.locationtech.jts.geom.Polygon;

import java.time.LocalDateTime;

/**
 * Geofence of a guarded site. Each active shift refers to exactly one of these.
 *
 * Design Rationale:
 * - Two shapes share one table: CIRCLE uses center + radius, POLYGON uses the JTS boundary
 * - The boundary column is PostGIS geometry with SRID 4326 (x = longitude, y = latitude)
 * - 'active' allows a geofence to be retired without deleting the shifts that referenced it
 *
 * Performance Note:
 * Ingest never reads this entity directly; it works on {@link CachedGeofenceRecord}
 * copies held by the geofence cache.
 */
@Entity
@Table(name = "site_geofences", indexes = {
    @Index(name = "idx_geofence_site", columnList = "site_id"),
    @Index(name = "idx_geofence_active", columnList = "active")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SiteGeofence {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "site_id", nullable = false, length = 100)
    private String siteId;

    @Column(nullable = false, length = 255)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GeofenceShape shape;

    @Column(name = "center_latitude")
    private Double centerLatitude;

    @Column(name = "center_longitude")
    private Double centerLongitude;

    @Column(name = "radius_meters")
    private Double radiusMeters;

    /**
     * Polygon boundary, only set for POLYGON geofences.
     */
    @Column(name = "boundary", columnDefinition = "geometry(Polygon,4326)")
    private Polygon boundary;

    /**
     * Security-level tag of the site (e.g. "STANDARD", "RESTRICTED")
     */
    @Column(name = "security_level", length = 50)
    private String securityLevel;

    @Column(nullable = false)
    @Builder.Default
    private Boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public CachedGeofenceRecord toCachedRecord() {
        if (shape == GeofenceShape.POLYGON) {
            return CachedGeofenceRecord.polygon(id, siteId, name, boundary, securityLevel);
        }
        return CachedGeofenceRecord.circle(id, siteId, name, centerLatitude, centerLongitude, radiusMeters, securityLevel);
    }

    /**
     * A geofence is usable when its shape has the fields that shape needs.
     */
    public boolean isWellFormed() {
        if (shape == GeofenceShape.POLYGON) {
            return boundary != null && !boundary.isEmpty();
        }
        return shape == GeofenceShape.CIRCLE
            && centerLatitude != null && centerLongitude != null
            && radiusMeters != null && radiusMeters > 0;
    }
}

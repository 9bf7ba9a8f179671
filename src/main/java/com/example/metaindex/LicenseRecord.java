package com.example.metaindex;

import jakarta.persistence.*;

/**
 * Dictionary entry for a detected license name. Content license facts store the id.
 */
@Entity
@Table(name = "fossology_license", uniqueConstraints = {
        @UniqueConstraint(name = "fossology_license_name_uniq", columnNames = {"name"})
})
public class LicenseRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "name", nullable = false, length = 512)
    private String name;

    public LicenseRecord() {}

    public LicenseRecord(String name) {
        this.name = name;
    }

    public Integer getId() { return id; }
    public String getName() { return name; }
}

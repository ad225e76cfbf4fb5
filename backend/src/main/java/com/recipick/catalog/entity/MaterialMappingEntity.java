package com.recipick.catalog.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Entity
@Table(name = "material_mapping")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MaterialMappingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "mapping_id")
    private Long id;

    @Column(name = "receipt_item", nullable = false, unique = true, length = 255)
    private String receiptItem;

    @Column(name = "standard_material", nullable = false, length = 255)
    private String standardMaterial;

    public MaterialMappingEntity(String receiptItem, String standardMaterial) {
        this.receiptItem = receiptItem;
        this.standardMaterial = standardMaterial;
    }
}

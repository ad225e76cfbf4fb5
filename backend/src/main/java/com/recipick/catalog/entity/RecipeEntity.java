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
@Table(name = "recipes")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RecipeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "recipe_id")
    private Long id;

    @Column(nullable = false, columnDefinition = "text")
    private String name;

    /**
     * JSON text: either an array of material names or {"core": [...], "optional": [...]}.
     */
    @Column(name = "required_materials", nullable = false, columnDefinition = "text")
    private String requiredMaterials;

    @Column(columnDefinition = "text")
    private String steps;

    @Column(name = "image_url", columnDefinition = "text")
    private String imageUrl;

    public RecipeEntity(String name, String requiredMaterials, String steps, String imageUrl) {
        this.name = name;
        this.requiredMaterials = requiredMaterials;
        this.steps = steps;
        this.imageUrl = imageUrl;
    }
}

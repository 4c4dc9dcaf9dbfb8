package dev.upgrader.model;

public record Tag(int id, String label) {
}

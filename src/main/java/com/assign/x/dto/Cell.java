package com.assign.x.dto;

public record Cell(int row, int col) {

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}

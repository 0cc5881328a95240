package com.factory.planner.persistence;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FactoryDocument {
    private List<NamedRate> recipes = new ArrayList<>();
}

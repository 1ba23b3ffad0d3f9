package com.pattern.fixture;

import java.util.ArrayList;
import java.util.List;

/**
 * Small host-side chart used by the guard and sandbox tests.
 * Palaces point back at the chart, so the graph is cyclic.
 */
public class SampleChart {

    private final String gender;
    private final List<Palace> palaces = new ArrayList<>();

    public SampleChart(String gender) {
        this.gender = gender;
    }

    public static SampleChart ziwei() {
        SampleChart chart = new SampleChart("male");
        chart.addPalace("命宫", "紫微", "天府");
        chart.addPalace("兄弟", "太阴");
        chart.addPalace("夫妻", "贪狼", "文昌", "左辅");
        chart.addPalace("交友");
        return chart;
    }

    public void addPalace(String name, String... stars) {
        palaces.add(new Palace(this, name, List.of(stars)));
    }

    public String getGender() {
        return gender;
    }

    public List<Palace> getPalaces() {
        return palaces;
    }

    public Palace getSoulPalace() {
        return palaces.isEmpty() ? null : palaces.get(0);
    }

    public Palace palace(String name) {
        for (Palace palace : palaces) {
            if (palace.getName().equals(name)) {
                return palace;
            }
        }
        return null;
    }

    public int countStars() {
        int total = 0;
        for (Palace palace : palaces) {
            total += palace.getStars().size();
        }
        return total;
    }
}

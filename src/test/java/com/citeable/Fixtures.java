package com.citeable;

import java.util.List;

/**
 * One populated citation per variant.
 */
final class Fixtures {

    private Fixtures() {
    }

    static Article article() {
        return Article.builder()
                .author("Huttley, Gavin", "Caley, Katherine", "McArthur, Robert")
                .title("diverse-seq: an application for alignment-free selecting and clustering biological sequences")
                .journal("Journal of Open Source Software")
                .year(2025)
                .volume(10)
                .number(110)
                .pages("7765")
                .doi("10.21105/joss.07765")
                .url("https://doi.org/10.21105/joss.07765")
                .app("diverse-seq")
                .build();
    }

    static List<Citation> allTypes() {
        return List.of(
                article(),
                Article.builder()
                        .author("Smith, A")
                        .title("Paper")
                        .journal("J")
                        .year(2024)
                        .volume(1)
                        .articleNumber("e123")
                        .note("A note")
                        .key("custom.key")
                        .build(),
                Book.builder()
                        .author("Knuth, Donald")
                        .title("The Art of Computer Programming")
                        .publisher("Addison-Wesley")
                        .year(1997)
                        .edition("3rd")
                        .editor("Smith, Jane", "Doe, John")
                        .build(),
                InProceedings.builder()
                        .author("Doe, John")
                        .title("A {DNA} Paper")
                        .booktitle("Proceedings of Foo")
                        .year(2023)
                        .pages("1--10")
                        .publisher("ACM")
                        .editor("Chair, Ed")
                        .build(),
                TechReport.builder()
                        .author("Turing, Alan")
                        .title("On Computable Numbers")
                        .institution("Cambridge")
                        .year(1936)
                        .number("TR-42")
                        .build(),
                Thesis.builder()
                        .author("Student, Alice")
                        .title("My Thesis")
                        .school("MIT")
                        .year(2022)
                        .thesisType(Thesis.PHD)
                        .doi("10.1234/thesis")
                        .build(),
                Thesis.builder()
                        .author("Student, Bob")
                        .title("My Other Thesis")
                        .school("Oxford")
                        .year(2021)
                        .thesisType(Thesis.MASTERS)
                        .build(),
                Software.builder()
                        .author("Dev, Jane")
                        .title("my-tool")
                        .year(2024)
                        .publisher("GitHub")
                        .version("1.0.0")
                        .license("BSD-3-Clause")
                        .url("https://github.com/example")
                        .app("my-plugin")
                        .build(),
                Misc.builder()
                        .author("Author, Some")
                        .title("A Misc Entry")
                        .year(2020)
                        .note("Some note")
                        .build());
    }
}

package org.codeaudit.lint.rules;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ComponentStructureCheckTest {

    @Test
    void problems_isEmpty_forWellFormedComponent() {
        var content = """
                defmodule AppWeb.BadgeComponent do
                  use Phoenix.LiveComponent

                  @moduledoc \"""
                  Badge.

                  ## Props
                    * `label` - text shown in the badge
                  \"""

                  @impl true
                  def update(assigns, socket), do: {:ok, assign(socket, assigns)}

                  def render(assigns) do
                    ~H\"""
                    <span><%= @label %></span>
                    \"""
                  end
                end
                """;

        assertThat(ComponentStructureCheck.isComponent(content)).isTrue();
        assertThat(ComponentStructureCheck.problems(content)).isEmpty();
    }

    @Test
    void problems_acceptsFunctionalComponentWithoutUpdate() {
        var content = """
                defmodule AppWeb.IconComponent do
                  use Phoenix.LiveComponent
                  @doc "Icon {:prop, :name}"
                  def render(assigns) do ~H"<i class={@name}></i>"
                  end
                end
                """;

        assertThat(ComponentStructureCheck.problems(content)).isEmpty();
    }

    @Test
    void problems_isEmpty_forLiveViews() {
        assertThat(ComponentStructureCheck.problems("defmodule AppWeb.PageLive do\n  use Phoenix.LiveView\nend")).isEmpty();
    }
}

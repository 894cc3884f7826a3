package com.assistant.relevance.router;

import java.util.List;

/**
 * Built-in route set with its tuned thresholds.
 */
public final class DefaultRoutes {

    private DefaultRoutes() {
        // Utility class
    }

    public static List<Route> routes() {
        return List.of(
                Route.of(RouteName.STOIC_SMALLTALK, 0.20, List.of(
                        "en que estas pensando",
                        "en que andas",
                        "dime algo bonito",
                        "decime algo lindo",
                        "dame una reflexion",
                        "frase estoica")),
                Route.of(RouteName.SELF_MAINTENANCE, 0.30, List.of(
                        "reinicia el agente",
                        "actualiza el repositorio",
                        "sumar habilidad",
                        "crear skill",
                        "eliminar skill",
                        "estado del servicio")),
                Route.of(RouteName.CONNECTOR, 0.30, List.of(
                        "inicia lim",
                        "deten lim",
                        "reinicia lim",
                        "estado del conector",
                        "arranca el tunnel",
                        "detener cloudflared",
                        "consulta lim first_name",
                        "buscar mensajes en lim",
                        "trae mensajes de contacto en lim")),
                Route.of(RouteName.SCHEDULE, 0.24, List.of(
                        "recordame mañana",
                        "agenda una tarea",
                        "programa recordatorio",
                        "listar recordatorios",
                        "editar tarea programada",
                        "eliminar tarea pendiente")),
                Route.of(RouteName.MEMORY, 0.24, List.of(
                        "te acordas de",
                        "recordas lo que hablamos",
                        "busca en memoria",
                        "que recuerdas sobre",
                        "acordate de esto",
                        "recordatorio de contexto")),
                Route.of(RouteName.GMAIL_RECIPIENTS, 0.28, List.of(
                        "agrega destinatario",
                        "lista destinatarios",
                        "actualiza destinatario",
                        "elimina destinatario",
                        "agenda de contactos de correo",
                        "contactos para email")),
                Route.of(RouteName.GMAIL, 0.27, List.of(
                        "enviar correo",
                        "enviame un email",
                        "revisar gmail",
                        "ultimo correo",
                        "leer inbox",
                        "mandar mail a")),
                Route.of(RouteName.WORKSPACE, 0.28, List.of(
                        "listar archivos",
                        "crear archivo txt",
                        "renombrar archivo",
                        "mover archivo a carpeta",
                        "eliminar archivo",
                        "crear carpeta en workspace")),
                Route.of(RouteName.DOCUMENT, 0.24, List.of(
                        "leer documento pdf",
                        "analiza este archivo",
                        "resumi el contrato",
                        "extrae texto del docx",
                        "abrir documento",
                        "que dice el pdf")),
                Route.of(RouteName.WEB, 0.23, List.of(
                        "busca en internet",
                        "ultimas noticias",
                        "revisa reddit",
                        "abre este link",
                        "noticias de cripto",
                        "resumen de noticias de hoy"))
        );
    }
}
